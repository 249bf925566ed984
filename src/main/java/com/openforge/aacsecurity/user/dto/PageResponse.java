package com.openforge.aacsecurity.user.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Stable JSON shape for paged listings, independent of Spring Data's {@link Page} serialization.
 */
public record PageResponse<T>(
        List<T> items,
        long    total,
        int     page,
        int     size
) {

    public static <E, T> PageResponse<T> of(Page<E> page, Function<E, T> mapper) {
        return new PageResponse<>(
                page.getContent().stream().map(mapper).toList(),
                page.getTotalElements(),
                page.getNumber(),
                page.getSize());
    }
}
