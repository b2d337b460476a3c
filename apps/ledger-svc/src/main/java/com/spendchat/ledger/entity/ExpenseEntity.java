package com.spendchat.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "expenses")
public class ExpenseEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "expense_date", nullable = false)
    private LocalDate expenseDate;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "expense_categories", joinColumns = @JoinColumn(name = "expense_id"))
    @Column(name = "category", nullable = false, length = 40)
    private Set<String> categories = new LinkedHashSet<>();

    // Default constructor for JPA
    public ExpenseEntity() {}

    public ExpenseEntity(String description, BigDecimal amount, LocalDate expenseDate,
                         Instant recordedAt, Set<String> categories) {
        this.description = description;
        this.amount = amount;
        this.expenseDate = expenseDate;
        this.recordedAt = recordedAt;
        this.categories = new LinkedHashSet<>(categories);
    }

    // Getters only past this point; rows are append-only
    public Long getId() { return id; }

    public String getDescription() { return description; }

    public BigDecimal getAmount() { return amount; }

    public LocalDate getExpenseDate() { return expenseDate; }

    public Instant getRecordedAt() { return recordedAt; }

    public Set<String> getCategories() { return categories; }
}
