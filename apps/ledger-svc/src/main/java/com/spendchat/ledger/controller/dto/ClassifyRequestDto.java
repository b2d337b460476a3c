package com.spendchat.ledger.controller.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ClassifyRequestDto(@NotNull @Size(max = 2000) String text) {
}
