package com.openparking.parking.api.controller;

import com.openparking.common.dto.BaseResponse;
import com.openparking.common.dto.PageResponse;
import com.openparking.common.util.Constants;
import com.openparking.parking.api.dto.CreateVehicleRequest;
import com.openparking.parking.api.dto.UpdateVehicleRequest;
import com.openparking.parking.api.dto.VehicleResponse;
import com.openparking.parking.domain.service.VehicleService;
import com.openparking.parking.security.AuthenticatedUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(Constants.API_PREFIX + "/vehicles")
@RequiredArgsConstructor
public class VehicleController {

    private final VehicleService vehicleService;

    @PostMapping
    public ResponseEntity<BaseResponse<VehicleResponse>> addVehicle(
            @Valid @RequestBody CreateVehicleRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        VehicleResponse response = vehicleService.addVehicle(request, user);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Vehicle added successfully", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<PageResponse<VehicleResponse>>> listVehicles(
            @AuthenticationPrincipal AuthenticatedUser user,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success("User's vehicles fetched successfully",
                vehicleService.listOwnVehicles(user, search, page, limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<VehicleResponse>> getVehicle(@PathVariable Long id,
                                                                    @AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(BaseResponse.success("Vehicle details fetched", vehicleService.getVehicle(id, user)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<VehicleResponse>> updateVehicle(
            @PathVariable Long id,
            @Valid @RequestBody UpdateVehicleRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(BaseResponse.success("Vehicle updated successfully",
                vehicleService.updateVehicle(id, request, user)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<BaseResponse<Void>> deleteVehicle(@PathVariable Long id,
                                                            @AuthenticationPrincipal AuthenticatedUser user) {
        vehicleService.deleteVehicle(id, user);
        return ResponseEntity.ok(BaseResponse.success("Vehicle deleted successfully", null));
    }
}
