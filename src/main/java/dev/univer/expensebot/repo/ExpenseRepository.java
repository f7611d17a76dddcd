package dev.univer.expensebot.repo;

import dev.univer.expensebot.model.Expense;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ExpenseRepository extends JpaRepository<Expense, Long> {
    List<Expense> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable page);

    // [from, to)
    List<Expense> findAllByUserIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtDesc(
            Long userId, Instant from, Instant to);

    List<Expense> findByUserIdAndCategoryIdOrderByCreatedAtDesc(Long userId, Long categoryId, Pageable page);

    @Query("""
           select e.currency as currency, sum(e.amount) as total
           from Expense e
           where e.userId = :userId and e.category.id = :categoryId
           group by e.currency
           order by e.currency""")
    List<CurrencyTotal> totalsByCategory(@Param("userId") Long userId, @Param("categoryId") Long categoryId);

    @Query("select e from Expense e join e.tags t where e.userId = :userId and t = :tag order by e.createdAt desc")
    List<Expense> findTagged(@Param("userId") Long userId, @Param("tag") String tag, Pageable page);

    @Query("select distinct t from Expense e join e.tags t where e.userId = :userId order by t")
    List<String> findTagsOfUser(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Expense e set e.category = null where e.category.id = :categoryId")
    int clearCategory(@Param("categoryId") Long categoryId);
}
