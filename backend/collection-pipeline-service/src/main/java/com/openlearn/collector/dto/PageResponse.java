package com.openlearn.collector.dto;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import org.springframework.data.domain.Page;

public record PageResponse<T>(
        List<T> content,
        int page,
        int size,
        long totalElements,
        int totalPages,
        boolean hasNext
) {
    public PageResponse {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        Objects.requireNonNull(page, "page must not be null");
        return new PageResponse<>(
                page.getContent().stream().map(mapper).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages(),
                page.hasNext()
        );
    }
}
