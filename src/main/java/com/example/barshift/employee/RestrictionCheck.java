package com.example.barshift.employee;

public record RestrictionCheck(boolean allowed, String reason) {

    private static final RestrictionCheck ALLOWED = new RestrictionCheck(true, null);

    public static RestrictionCheck allow() {
        return ALLOWED;
    }

    public static RestrictionCheck deny(String reason) {
        return new RestrictionCheck(false, reason);
    }
}
