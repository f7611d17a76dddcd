package dev.univer.expensebot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.univer.expensebot.model.Expense;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class TagCommandServiceTest {

    private static final long USER = 7L;

    @Mock
    ExpenseService expenseService;

    TagCommandService service;
    Expense expense;

    @BeforeEach
    void setUp() {
        service = new TagCommandService(expenseService);
        expense = Expense.builder()
                .id(42L)
                .userId(USER)
                .amount(new BigDecimal("12"))
                .currency("SGD")
                .description("Lunch")
                .tags(new ArrayList<>(List.of("work")))
                .build();
    }

    @Test
    void tagAddsLowercaseTagsOnce() {
        when(expenseService.findById(42L)).thenReturn(Optional.of(expense));

        String text = service.tag(USER, "42 #Client work #client");

        assertThat(expense.getTags()).containsExactly("work", "client");
        verify(expenseService).update(expense);
        assertThat(text).isEqualTo("✅ Added #client, #work to expense #42.\n🏷️ Tags: #work #client");
    }

    @Test
    void tagArgumentErrors() {
        assertThat(service.tag(USER, null)).startsWith("❌ Usage: /tag <id>");
        assertThat(service.tag(USER, "42")).startsWith("❌ Usage: /tag <id>");
        assertThat(service.tag(USER, "x #work")).startsWith("❌ Invalid expense ID.");
        assertThat(service.tag(USER, "42 #a #b #c #d #e #f #g #h #i #j #k"))
                .isEqualTo("❌ Too many tags. Maximum 10 tags per command.");
        verifyNoInteractions(expenseService);
    }

    @Test
    void tagRejectsInvalidNameWithoutSaving() {
        when(expenseService.findById(42L)).thenReturn(Optional.of(expense));

        assertThat(service.tag(USER, "42 #ok #2fast")).isEqualTo(
                "❌ Invalid tag name '2fast'. Tags must start with a letter, contain only letters/numbers/underscores, "
                + "and be at most 30 characters");
        assertThat(expense.getTags()).containsExactly("work");
        verify(expenseService, never()).update(any());
    }

    @Test
    void tagOnlySelfOwned() {
        when(expenseService.findById(42L)).thenReturn(Optional.of(expense));
        when(expenseService.findById(43L)).thenReturn(Optional.empty());

        assertThat(service.tag(99L, "42 #work")).isEqualTo("❌ You can only tag your own expenses.");
        assertThat(service.tag(USER, "43 #work")).isEqualTo("❌ Expense #43 not found.");
    }

    @Test
    void untagRemovesTheTag() {
        when(expenseService.findById(42L)).thenReturn(Optional.of(expense));

        assertThat(service.untag(USER, "42 #WORK")).isEqualTo("✅ Removed #work from expense #42.");
        assertThat(expense.getTags()).isEmpty();
        verify(expenseService).update(expense);
    }

    @Test
    void untagErrors() {
        when(expenseService.findById(42L)).thenReturn(Optional.of(expense));

        assertThat(service.untag(USER, "42")).isEqualTo("❌ Usage: /untag <id> #tag");
        assertThat(service.untag(USER, "42 #home")).isEqualTo("❌ Tag 'home' not found.");
        assertThat(service.untag(USER, "42 #no-dash")).startsWith("❌ Invalid tag name 'no-dash'.");
        assertThat(service.untag(99L, "42 #work")).isEqualTo("❌ You can only untag your own expenses.");
        verify(expenseService, never()).update(any());
    }

    @Test
    void failedUntagAsksToRetry() {
        when(expenseService.findById(42L)).thenReturn(Optional.of(expense));
        when(expenseService.update(expense)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(service.untag(USER, "42 work")).isEqualTo("❌ Failed to remove tag. Please try again.");
    }

    @Test
    void tagsListsTheUsersTags() {
        when(expenseService.tagsOf(USER)).thenReturn(List.of("client", "work"));

        assertThat(service.tags(USER, null)).isEqualTo("🏷️ Tags\n\n1. #client\n2. #work");
    }

    @Test
    void tagsWhenThereAreNone() {
        when(expenseService.tagsOf(USER)).thenReturn(List.of());

        assertThat(service.tags(USER, " ")).startsWith("🏷️ No tags found.");
    }

    @Test
    void tagsWithNameListsTaggedExpenses() {
        when(expenseService.tagged(USER, "work", TagCommandService.TAGGED_LIST_LIMIT)).thenReturn(List.of(expense));

        String text = service.tags(USER, "#Work");

        assertThat(text).startsWith("🏷️ Expenses tagged #work\n\n");
        assertThat(text).contains("#42 S$12.00 SGD — Lunch [Uncategorized] #work");
    }

    @Test
    void tagsWithUnknownName() {
        when(expenseService.tagged(USER, "home", TagCommandService.TAGGED_LIST_LIMIT)).thenReturn(List.of());

        assertThat(service.tags(USER, "home")).isEqualTo("❌ Tag 'home' not found.\n\nUse /tags to see all tags.");
    }

    @Test
    void failedTagReadAsksToRetry() {
        when(expenseService.tagsOf(USER)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(service.tags(USER, null)).isEqualTo("❌ Failed to fetch tags. Please try again.");
    }
}
