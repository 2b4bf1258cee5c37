package net.morkit.util;

import net.morkit.api.parser.TextLocation;

public final class Locations {

    public static class FixedLocation implements TextLocation {

        private final long line;
        private final long column;
        private final long characterIndex;

        public FixedLocation(long line, long column, long characterIndex) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
        }
        public FixedLocation(TextLocation other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex());
        }

        public String toString() {
            return String.format("line %d column %d", getLine(),
                                 getColumn());
        }

        public boolean equals(Object other) {
            if (! (other instanceof FixedLocation)) return false;
            FixedLocation co = (FixedLocation) other;
            return (line == co.getLine() &&
                    column == co.getColumn() &&
                    characterIndex == co.getCharacterIndex());
        }

        public int hashCode() {
            return (int) (line ^ line >>> 31 ^ column ^ column >>> 31 ^
                characterIndex ^ characterIndex >>> 31);
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

    }

    /* Columns count characters; a CR LF pair counts as a single line
     * break. */
    public static class LocationTracker implements TextLocation {

        private long line;
        private long column;
        private long characterIndex;
        private boolean inNL;

        public LocationTracker(long line, long column, long characterIndex) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
            this.inNL = false;
        }
        public LocationTracker(TextLocation other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex());
        }
        public LocationTracker() {
            this(1, 1, 0);
        }

        public String toString() {
            return String.format("%s@%h[line=%s,column=%s,char=%s,inNL=%s]",
                getClass().getName(), this, getLine(), getColumn(),
                getCharacterIndex(), inNL);
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

        public FixedLocation freeze() {
            return new FixedLocation(this);
        }

        public void advance(char ch) {
            characterIndex++;
            if (ch == '\n' && inNL) {
                // Second half of a CR LF pair.
            } else if (ch == '\n' || ch == '\r') {
                line++;
                column = 1;
            } else {
                column++;
            }
            inNL = (ch == '\r');
        }
        public void advance(CharSequence data, int offset, int size) {
            for (int i = offset, ei = offset + size; i < ei; i++) {
                advance(data.charAt(i));
            }
        }
        public void advance(CharSequence data) {
            advance(data, 0, data.length());
        }

    }

    /* Prevent construction */
    private Locations() {}

    /**
     * Return the location reached after reading text starting from start.
     */
    public static FixedLocation after(TextLocation start, CharSequence text) {
        LocationTracker tr = new LocationTracker(start);
        tr.advance(text);
        return tr.freeze();
    }

}
