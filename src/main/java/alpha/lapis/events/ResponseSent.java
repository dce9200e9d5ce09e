package alpha.lapis.events;

import alpha.lapis.message.SerializedResponse;

/**
 * A response has been successfully written to the exchange.<p>
 *
 * The intended purpose of this event is to gather metrics.<p>
 *
 * The first attachment given to the listener is the {@link SerializedResponse}
 * sent. The second attachment is an instance of {@link Stats}.
 */
public enum ResponseSent {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;

    /**
     * Statistics concerning a response sent.<p>
     *
     * The start time is taken when the request was received by the
     * dispatcher, and the stop time after the response was written. The
     * elapsed time therefore covers matching, handler execution and writing.
     */
    public static final class Stats extends AbstractStats
    {
        private final long bytes;

        /**
         * Constructs this object.
         *
         * @param start {@link System#nanoTime()} on start
         * @param stop {@link System#nanoTime()} on stop
         * @param bytes written
         */
        public Stats(long start, long stop, long bytes) {
            super(start, stop);
            this.bytes = bytes;
        }

        /**
         * Returns the number of bytes written.
         *
         * @return the number of bytes written
         */
        public long bytes() {
            return bytes;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + Long.hashCode(bytes);
        }

        @Override
        public boolean equals(Object obj) {
            return super.equals(obj) && bytes == ((Stats) obj).bytes;
        }

        @Override
        public String toString() {
            return ResponseSent.class.getSimpleName() + '.' + Stats.class.getSimpleName() + "{" +
                    "start=" + nanoTimeOnStart() +
                    ", stop=" + nanoTimeOnStop() +
                    ", bytes=" + bytes + '}';
        }
    }
}
