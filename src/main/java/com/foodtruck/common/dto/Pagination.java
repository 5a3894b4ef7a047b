package com.foodtruck.common.dto;

public record Pagination(int offset, int limit, long totalCount, int totalPages, int page) {

    public static Pagination of(PageQuery query, long totalCount) {
        int limit = query.limit();
        int totalPages = (int) ((totalCount + limit - 1) / limit);
        return new Pagination(query.offset(), limit, totalCount, totalPages, query.offset() / limit + 1);
    }
}
