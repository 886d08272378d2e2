package com.fontembed.pdf;

import com.fontembed.font.FakeFontHandle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FontFlagsTest {

    @Test
    void plainFontIsOnlySymbolic() {
        assertThat(FontFlags.derive(new FakeFontHandle())).isEqualTo(FontFlags.SYMBOLIC);
    }

    @Test
    void serifFamilyClassesSetSerif() {
        for (int familyClass = 1; familyClass <= 7; familyClass++) {
            assertThat(FontFlags.derive(new FakeFontHandle().familyClass(familyClass)) & FontFlags.SERIF)
                    .as("family class %d", familyClass)
                    .isEqualTo(FontFlags.SERIF);
        }
        assertThat(FontFlags.derive(new FakeFontHandle().familyClass(8)) & FontFlags.SERIF).isZero();
    }

    @Test
    void scriptFamilyClassSetsScript() {
        assertThat(FontFlags.derive(new FakeFontHandle().familyClass(10)))
                .isEqualTo(FontFlags.SYMBOLIC | FontFlags.SCRIPT);
    }

    @Test
    void fixedPitchAndItalicCombine() {
        int flags = FontFlags.derive(new FakeFontHandle().fixedPitch(true).italic(true));

        assertThat(flags).isEqualTo(FontFlags.FIXED_PITCH | FontFlags.SYMBOLIC | FontFlags.ITALIC);
        assertThat(flags).isEqualTo(1 | 4 | 64);
    }
}
