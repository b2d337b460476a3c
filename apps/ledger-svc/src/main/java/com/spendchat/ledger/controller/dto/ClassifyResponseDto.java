package com.spendchat.ledger.controller.dto;

import java.util.List;

public record ClassifyResponseDto(List<String> categories) {
}
