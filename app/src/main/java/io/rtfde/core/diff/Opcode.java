package io.rtfde.core.diff;

/**
 * A half-open range pair in the original and revised sequences, tagged with how the two ranges relate.
 */
record Opcode(Kind kind, int beginA, int endA, int beginB, int endB) {

    enum Kind {
        EQUAL("  "),
        REPLACE("! "),
        DELETE("- "),
        INSERT("+ ");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        String prefix() {
            return prefix;
        }
    }

    Opcode {
        if (beginA < 0 || endA < beginA || beginB < 0 || endB < beginB) {
            throw new IllegalArgumentException("Invalid opcode range");
        }
    }

    int lengthA() {
        return endA - beginA;
    }
}
