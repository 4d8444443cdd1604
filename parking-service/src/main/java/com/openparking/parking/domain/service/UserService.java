package com.openparking.parking.domain.service;

import com.openparking.common.dto.PageResponse;
import com.openparking.common.exception.BusinessException;
import com.openparking.common.exception.ResourceNotFoundException;
import com.openparking.common.util.Pagination;
import com.openparking.parking.api.dto.UserDetailResponse;
import com.openparking.parking.api.dto.UserResponse;
import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.model.SlotRequest;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.repository.ActionLogRepository;
import com.openparking.parking.domain.repository.ParkingSlotRepository;
import com.openparking.parking.domain.repository.SlotRequestRepository;
import com.openparking.parking.domain.repository.UserRepository;
import com.openparking.parking.domain.repository.VehicleRepository;
import com.openparking.parking.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Administrative user management.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final VehicleRepository vehicleRepository;
    private final SlotRequestRepository requestRepository;
    private final ParkingSlotRepository slotRepository;
    private final ActionLogRepository actionLogRepository;
    private final ActionLogService actionLogService;

    @Transactional(readOnly = true)
    public PageResponse<UserResponse> listUsers(String search, Integer page, Integer limit) {
        return PageResponse.from(
                userRepository.search(Pagination.searchTerm(search),
                        Pagination.of(page, limit, Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")))),
                UserResponse::from);
    }

    @Transactional(readOnly = true)
    public UserDetailResponse getUser(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        return UserDetailResponse.from(user,
                vehicleRepository.findByUserId(userId),
                requestRepository.findByUserId(userId));
    }

    /**
     * Deletes a user and everything they own.
     *
     * Order matters: slots held by the user's approved requests go back to AVAILABLE first,
     * then the user's action logs, slot requests and vehicles are removed, then the user.
     * The user's requests stay locked from the start so no approval can slip in between.
     */
    @Transactional
    public void deleteUser(Long userId, AuthenticatedUser admin) {
        if (userId.equals(admin.id())) {
            throw new BusinessException("Admin cannot delete their own account through this endpoint.");
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        List<Long> heldSlots = requestRepository.findAllByUserIdWithLock(userId).stream()
                .filter(r -> r.getRequestStatus() == RequestStatus.APPROVED)
                .map(SlotRequest::getSlotId)
                .filter(Objects::nonNull)
                .toList();
        int released = slotRepository.releaseAll(heldSlots);

        int logs = actionLogRepository.deleteAllByUserId(userId);
        int requests = requestRepository.deleteAllByUserId(userId);
        int vehicles = vehicleRepository.deleteAllByUserId(userId);
        userRepository.deleteById(userId);

        log.info("User {} deleted by admin {}: {} slot(s) released, {} request(s), {} vehicle(s), {} log entries removed",
                userId, admin.id(), released, requests, vehicles, logs);
        actionLogService.record(AuditAction.USER_DELETED_BY_ADMIN, admin.id(),
                Map.of("deletedUserId", userId, "deletedUserEmail", user.getEmail()));
    }
}
