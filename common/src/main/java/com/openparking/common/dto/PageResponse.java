package com.openparking.common.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing. {@code currentPage} is 1-based, matching the {@code page} query parameter.
 */
public record PageResponse<T>(
        List<T> data,
        int currentPage,
        int totalPages,
        long totalItems,
        int itemsPerPage
) {
    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        return new PageResponse<>(
                page.getContent().stream().map(mapper).toList(),
                page.getNumber() + 1,
                page.getTotalPages(),
                page.getTotalElements(),
                page.getSize()
        );
    }
}
