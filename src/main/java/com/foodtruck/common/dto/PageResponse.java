package com.foodtruck.common.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

public record PageResponse<T>(List<T> items, Pagination pagination) {

    public static <E, T> PageResponse<T> of(Page<E> page, PageQuery query, Function<E, T> mapper) {
        List<T> items = page.getContent().stream().map(mapper).toList();
        return new PageResponse<>(items, Pagination.of(query, page.getTotalElements()));
    }
}
