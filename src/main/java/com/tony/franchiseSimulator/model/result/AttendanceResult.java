package com.tony.franchiseSimulator.model.result;

public record AttendanceResult(int averageAttendance, long totalAttendance) {}
