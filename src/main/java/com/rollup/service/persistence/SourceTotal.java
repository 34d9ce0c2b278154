package com.rollup.service.persistence;

public record SourceTotal(String source, long visitors) {
}
