package com.repoatlas.core.profile;

/**
 * One rendered block of the profile.
 *
 * @param title section title without heading markup
 * @param text  rendered text, heading included
 * @param shown items rendered
 * @param total items available before capping and budget trimming
 */
public record ProfileSection(String title, String text, int shown, int total) {

    public int chars() {
        return text.length();
    }

    public boolean truncated() {
        return shown < total;
    }
}
