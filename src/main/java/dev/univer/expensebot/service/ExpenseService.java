package dev.univer.expensebot.service;

import dev.univer.expensebot.model.Expense;
import dev.univer.expensebot.repo.CurrencyTotal;
import dev.univer.expensebot.repo.ExpenseRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ExpenseService {
    private final ExpenseRepository expenseRepository;

    public Optional<Expense> findById(Long id) {
        return expenseRepository.findById(id);
    }

    @Transactional
    public Expense create(Expense expense) {
        Instant now = Instant.now();
        expense.setCreatedAt(now);
        expense.setUpdatedAt(now);
        return expenseRepository.save(expense);
    }

    @Transactional
    public Expense update(Expense expense) {
        expense.setUpdatedAt(Instant.now());
        return expenseRepository.save(expense);
    }

    @Transactional
    public void delete(Expense expense) {
        expenseRepository.delete(expense);
    }

    public List<Expense> recent(Long userId, int limit) {
        return expenseRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, limit));
    }

    /** Expenses created in {@code [from, to)}, newest first. */
    public List<Expense> between(Long userId, Instant from, Instant to) {
        return expenseRepository.findAllByUserIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtDesc(
                userId, from, to);
    }

    public List<Expense> inCategory(Long userId, Long categoryId, int limit) {
        return expenseRepository.findByUserIdAndCategoryIdOrderByCreatedAtDesc(userId, categoryId, PageRequest.of(0, limit));
    }

    /** Sum per currency code of every expense of the user in the category. */
    public Map<String, BigDecimal> categoryTotals(Long userId, Long categoryId) {
        return expenseRepository.totalsByCategory(userId, categoryId).stream()
                .collect(Collectors.toMap(CurrencyTotal::getCurrency, CurrencyTotal::getTotal, BigDecimal::add, TreeMap::new));
    }

    public List<Expense> tagged(Long userId, String tag, int limit) {
        return expenseRepository.findTagged(userId, tag, PageRequest.of(0, limit));
    }

    /** Distinct tags on the user's expenses, alphabetical. */
    public List<String> tagsOf(Long userId) {
        return expenseRepository.findTagsOfUser(userId);
    }
}
