package com.spendchat.ledger.repository;

import com.spendchat.ledger.entity.ExpenseEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaExpenseRepository extends JpaRepository<ExpenseEntity, Long> {

    @Query("SELECT e FROM ExpenseEntity e ORDER BY e.id ASC")
    List<ExpenseEntity> findAllInInsertionOrder();

    @Query("SELECT e FROM ExpenseEntity e WHERE e.expenseDate = :date ORDER BY e.id ASC")
    List<ExpenseEntity> findByExpenseDate(@Param("date") LocalDate date);

    @Query("SELECT DISTINCT e FROM ExpenseEntity e JOIN e.categories c WHERE c = :category ORDER BY e.id ASC")
    List<ExpenseEntity> findByCategory(@Param("category") String category);

    @Query("""
            SELECT DISTINCT e FROM ExpenseEntity e JOIN e.categories c
            WHERE c = :category AND e.expenseDate = :date
            ORDER BY e.id ASC
            """)
    List<ExpenseEntity> findByCategoryAndExpenseDate(@Param("category") String category,
                                                     @Param("date") LocalDate date);
}
