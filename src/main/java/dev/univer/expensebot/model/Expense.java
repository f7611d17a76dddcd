package dev.univer.expensebot.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_expense_user_time", columnList = "userId, createdAt")
})
public class Expense {
    public static final int AMOUNT_SCALE = 4;

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Telegram user who reported it
    @Column(nullable = false)
    private Long userId;

    @Column(precision = 19, scale = AMOUNT_SCALE, nullable = false)
    private BigDecimal amount;

    @Column(length = 3, nullable = false)
    private String currency;

    @Column(length = 512)
    private String description;

    @Column(length = 512)
    private String merchant;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "category_id", foreignKey = @ForeignKey(name = "fk_expense_category"))
    private Category category;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "expense_tag", joinColumns = @JoinColumn(name = "expense_id"))
    @OrderColumn(name = "tag_order")
    @Column(name = "tag", length = 30)
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;
}
