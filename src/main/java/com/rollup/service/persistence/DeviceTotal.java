package com.rollup.service.persistence;

public record DeviceTotal(String browser, String os, long visitors) {
}
