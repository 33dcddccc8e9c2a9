package com.datatoexcel.converter.convert;

/**
 * Notified while tables are emitted.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
        @Override
        public void started(int total) {
        }

        @Override
        public void advanced(int done, int total) {
        }

        @Override
        public void finished() {
        }
    };

    void started(int total);

    void advanced(int done, int total);

    void finished();
}
