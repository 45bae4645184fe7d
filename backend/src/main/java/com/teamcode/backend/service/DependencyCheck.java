package com.teamcode.backend.service;

import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.Team;

/**
 * Decides whether the prerequisites of a question are satisfied for a team.
 * A question without edges of an operator is satisfied for that operator.
 */
public interface DependencyCheck {

    /** At least one OR prerequisite was answered correctly by the team. */
    boolean orDependenciesCompleted(Question question, Team team);

    /** Every AND prerequisite was answered correctly by the team. */
    boolean andDependenciesCompleted(Question question, Team team);
}
