package com.fontembed.pdf;

import com.fontembed.font.FontHandle;

/**
 * Флаги /Flags дескриптора шрифта (PDF 32000-1, таблица 123).
 */
public final class FontFlags {

    public static final int FIXED_PITCH = 1;
    public static final int SERIF = 1 << 1;
    public static final int SYMBOLIC = 1 << 2;
    public static final int SCRIPT = 1 << 3;
    public static final int ITALIC = 1 << 6;

    private static final int FAMILY_CLASS_SCRIPTS = 10;

    private FontFlags() {
    }

    public static int derive(FontHandle font) {
        int familyClass = font.familyClass();
        int flags = 0;
        if (font.isFixedPitch()) {
            flags |= FIXED_PITCH;
        }
        if (familyClass >= 1 && familyClass <= 7) {
            flags |= SERIF;
        }
        // Составной шрифт может содержать глифы вне стандартного латинского набора.
        flags |= SYMBOLIC;
        if (familyClass == FAMILY_CLASS_SCRIPTS) {
            flags |= SCRIPT;
        }
        if (font.isItalic()) {
            flags |= ITALIC;
        }
        return flags;
    }
}
