package com.openparking.parking.api.controller;

import com.openparking.common.dto.BaseResponse;
import com.openparking.common.dto.PageResponse;
import com.openparking.common.util.Constants;
import com.openparking.parking.api.dto.BulkCreateParkingSlotsRequest;
import com.openparking.parking.api.dto.BulkCreateParkingSlotsResponse;
import com.openparking.parking.api.dto.CreateParkingSlotRequest;
import com.openparking.parking.api.dto.ParkingSlotResponse;
import com.openparking.parking.api.dto.UpdateParkingSlotRequest;
import com.openparking.parking.domain.service.ParkingSlotService;
import com.openparking.parking.security.AuthenticatedUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(Constants.API_PREFIX + "/parking-slots")
@RequiredArgsConstructor
public class ParkingSlotController {

    private final ParkingSlotService slotService;

    @PostMapping
    public ResponseEntity<BaseResponse<ParkingSlotResponse>> createSlot(
            @Valid @RequestBody CreateParkingSlotRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {
        ParkingSlotResponse response = slotService.createSlot(request, admin);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Parking slot created successfully", response));
    }

    /**
     * 201 when every slot was created, 207 with the created slots and per-item errors otherwise.
     */
    @PostMapping("/bulk")
    public ResponseEntity<BaseResponse<BulkCreateParkingSlotsResponse>> bulkCreateSlots(
            @Valid @RequestBody BulkCreateParkingSlotsRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {
        BulkCreateParkingSlotsResponse result = slotService.bulkCreateSlots(request.slots(), admin);
        if (result.hasErrors()) {
            String message = String.format("Bulk operation partially successful. %d slots created, %d failed.",
                    result.createdSlots().size(), result.errors().size());
            return ResponseEntity.status(HttpStatus.MULTI_STATUS).body(BaseResponse.success(message, result));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success(
                result.createdSlots().size() + " slots created successfully.", result));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<PageResponse<ParkingSlotResponse>>> listSlots(
            @AuthenticationPrincipal AuthenticatedUser user,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success("Parking slots fetched successfully",
                slotService.listSlots(user, status, search, page, limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<ParkingSlotResponse>> getSlot(@PathVariable Long id,
                                                                     @AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(BaseResponse.success("Parking slot details fetched", slotService.getSlot(id, user)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<ParkingSlotResponse>> updateSlot(
            @PathVariable Long id,
            @Valid @RequestBody UpdateParkingSlotRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {
        return ResponseEntity.ok(BaseResponse.success("Parking slot updated successfully",
                slotService.updateSlot(id, request, admin)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<BaseResponse<Void>> deleteSlot(@PathVariable Long id,
                                                         @AuthenticationPrincipal AuthenticatedUser admin) {
        slotService.deleteSlot(id, admin);
        return ResponseEntity.ok(BaseResponse.success("Parking slot deleted successfully", null));
    }
}
