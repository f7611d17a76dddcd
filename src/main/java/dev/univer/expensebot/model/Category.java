package dev.univer.expensebot.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_category_normalized_name", columnList = "normalizedName", unique = true)
})
public class Category {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 50, nullable = false)
    private String name;           // as typed when created

    @Column(length = 50, nullable = false)
    private String normalizedName; // lower-case trimmed for uniqueness

    private Instant createdAt;
}
