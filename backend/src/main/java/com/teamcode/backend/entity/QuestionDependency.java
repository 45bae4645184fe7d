package com.teamcode.backend.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Directed edge: {@code question1} can only be answered once {@code question2} has been
 * answered correctly, combined with the other edges of the same operator.
 */
@Entity
@Table(name = "question_dependencies", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"question_1_id", "question_2_id"})
})
@Getter
@Setter
@NoArgsConstructor
public class QuestionDependency {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "question_1_id", nullable = false)
    private Question question1;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "question_2_id", nullable = false)
    private Question question2;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private DependencyOperator operator;

    public QuestionDependency(Question question1, Question question2, DependencyOperator operator) {
        this.question1 = question1;
        this.question2 = question2;
        this.operator = operator;
    }
}
