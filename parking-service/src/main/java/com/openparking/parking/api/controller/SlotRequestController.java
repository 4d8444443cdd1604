package com.openparking.parking.api.controller;

import com.openparking.common.dto.BaseResponse;
import com.openparking.common.dto.PageResponse;
import com.openparking.common.util.Constants;
import com.openparking.parking.api.dto.ApproveSlotRequestRequest;
import com.openparking.parking.api.dto.CreateSlotRequestRequest;
import com.openparking.parking.api.dto.RejectSlotRequestRequest;
import com.openparking.parking.api.dto.SlotRequestDetailResponse;
import com.openparking.parking.api.dto.SlotRequestResponse;
import com.openparking.parking.api.dto.UpdateSlotRequestRequest;
import com.openparking.parking.domain.service.SlotRequestService;
import com.openparking.parking.security.AuthenticatedUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Slot request lifecycle. Users create, edit and cancel their own requests;
 * administrators approve or reject them.
 */
@RestController
@RequestMapping(Constants.API_PREFIX + "/slot-requests")
@RequiredArgsConstructor
public class SlotRequestController {

    private final SlotRequestService slotRequestService;

    @PostMapping
    public ResponseEntity<BaseResponse<SlotRequestResponse>> createRequest(
            @Valid @RequestBody CreateSlotRequestRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        SlotRequestResponse response = slotRequestService.create(request.vehicleId(), user);
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success(
                "Slot request created successfully. Awaiting admin approval.", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<PageResponse<SlotRequestDetailResponse>>> listRequests(
            @AuthenticationPrincipal AuthenticatedUser user,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success("Slot requests fetched successfully",
                slotRequestService.list(user, status, search, page, limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<SlotRequestDetailResponse>> getRequest(
            @PathVariable Long id,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(BaseResponse.success("Slot request details fetched",
                slotRequestService.get(id, user)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<SlotRequestResponse>> updateRequest(
            @PathVariable Long id,
            @Valid @RequestBody UpdateSlotRequestRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(BaseResponse.success("Slot request updated successfully.",
                slotRequestService.update(id, request.vehicleId(), user)));
    }

    @PatchMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<SlotRequestResponse>> cancelRequest(
            @PathVariable Long id,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(BaseResponse.success("Slot request cancelled successfully.",
                slotRequestService.cancel(id, user)));
    }

    @PatchMapping("/{id}/approve")
    public ResponseEntity<BaseResponse<SlotRequestResponse>> approveRequest(
            @PathVariable Long id,
            @RequestBody(required = false) ApproveSlotRequestRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {
        Long slotId = request == null ? null : request.slotId();
        return ResponseEntity.ok(BaseResponse.success("Slot request approved and slot assigned.",
                slotRequestService.approve(id, slotId, admin)));
    }

    @PatchMapping("/{id}/reject")
    public ResponseEntity<BaseResponse<SlotRequestResponse>> rejectRequest(
            @PathVariable Long id,
            @Valid @RequestBody(required = false) RejectSlotRequestRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {
        String reason = request == null ? null : request.rejectionReason();
        return ResponseEntity.ok(BaseResponse.success("Slot request rejected.",
                slotRequestService.reject(id, reason, admin)));
    }
}
