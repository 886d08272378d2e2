package com.fontembed.font;

import java.util.List;

/**
 * Разобранная шрифтовая программа. Все метрики в единицах шрифта (units per em),
 * экземпляр неизменяем после загрузки.
 */
public interface FontHandle {

    /**
     * PostScript-имя из таблицы name или {@code null}, если его нет.
     */
    String postscriptName();

    int unitsPerEm();

    /**
     * Типографский подъём; {@code 0}, если шрифт его не сообщает.
     */
    double ascent();

    /**
     * Типографский спуск (обычно отрицательный); {@code 0}, если шрифт его не сообщает.
     */
    double descent();

    double capHeight();

    double xHeight();

    FontBBox bbox();

    double italicAngle();

    FontKind kind();

    boolean isFixedPitch();

    /**
     * Класс семейства IBM из таблицы OS/2 (старший байт sFamilyClass), {@code 0} при отсутствии.
     */
    int familyClass();

    boolean isItalic();

    /**
     * Все кодовые точки, покрытые Unicode-cmap шрифта, в произвольном порядке.
     */
    List<Integer> characterSet();

    Glyph glyphForCodePoint(int codePoint);

    /**
     * Раскладывает {@code text} на глифы в порядке отрисовки. Ширины продвижения уже
     * учитывают парный кернинг.
     */
    List<Glyph> layout(String text);
}
