package com.caf.backend.modules.notification.presentation.dto;

public record UpdatedCountResponse(int updatedCount) {
}
