package uk.gegc.trivia.features.question.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.trivia.features.question.domain.model.Question;

import java.util.Collection;
import java.util.List;

@Repository
public interface QuestionRepository extends JpaRepository<Question, Integer> {

    List<Question> findAllByOrderByIdAsc();

    List<Question> findByCategoryOrderByIdAsc(Integer category);

    /**
     * Literal, case-insensitive substring match on the question text.
     */
    List<Question> findByQuestionContainingIgnoreCaseOrderByIdAsc(String term);

    /**
     * Questions eligible for a quiz round, optionally restricted to one category.
     * A {@code null} category selects every question.
     */
    @Query("""
            SELECT q
            FROM Question q
            WHERE (:category IS NULL OR q.category = :category)
            ORDER BY q.id
            """)
    List<Question> findQuizCandidates(@Param("category") Integer category);

    /**
     * Same as {@link #findQuizCandidates(Integer)}, minus the questions already asked.
     * {@code excluded} must not be empty.
     */
    @Query("""
            SELECT q
            FROM Question q
            WHERE (:category IS NULL OR q.category = :category)
              AND q.id NOT IN :excluded
            ORDER BY q.id
            """)
    List<Question> findQuizCandidatesExcluding(@Param("category") Integer category,
                                               @Param("excluded") Collection<Integer> excluded);
}
