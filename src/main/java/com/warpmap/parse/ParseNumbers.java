package com.warpmap.parse;

final class ParseNumbers {

    private ParseNumbers() {
    }

    /**
     * Regex groups only admit digits, so the only failure left is overflow.
     */
    static Integer parseIntOrNull(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
