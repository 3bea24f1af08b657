package com.docprinter.printer;

/**
 * Display width of printed text. East Asian wide and full-width characters take two
 * columns, a tab takes {@code tabWidth} columns.
 */
public final class StringWidth {

    private StringWidth() {
    }

    public static int of(CharSequence text, int tabWidth) {
        int length = text.length();
        boolean simple = true;
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c >= 0x1100 || c == '\t') {
                simple = false;
                break;
            }
        }
        if (simple) {
            return length;
        }

        int width = 0;
        for (int i = 0; i < length; ) {
            int codePoint = Character.codePointAt(text, i);
            if (codePoint == '\t') {
                width += tabWidth;
            } else {
                width += isWide(codePoint) ? 2 : 1;
            }
            i += Character.charCount(codePoint);
        }
        return width;
    }

    private static boolean isWide(int cp) {
        return (cp >= 0x1100 && cp <= 0x115F)
                || (cp >= 0x2E80 && cp <= 0x303E)
                || (cp >= 0x3041 && cp <= 0x33FF)
                || (cp >= 0x3400 && cp <= 0x4DBF)
                || (cp >= 0x4E00 && cp <= 0x9FFF)
                || (cp >= 0xA000 && cp <= 0xA4CF)
                || (cp >= 0xAC00 && cp <= 0xD7A3)
                || (cp >= 0xF900 && cp <= 0xFAFF)
                || (cp >= 0xFE30 && cp <= 0xFE4F)
                || (cp >= 0xFF00 && cp <= 0xFF60)
                || (cp >= 0xFFE0 && cp <= 0xFFE6)
                || (cp >= 0x1F300 && cp <= 0x1F64F)
                || (cp >= 0x1F900 && cp <= 0x1F9FF)
                || (cp >= 0x20000 && cp <= 0x3FFFD);
    }
}
