package com.openparking.parking.api.dto;

/**
 * @param slotId slot to assign manually; null for automatic selection
 */
public record ApproveSlotRequestRequest(Long slotId) {
}
