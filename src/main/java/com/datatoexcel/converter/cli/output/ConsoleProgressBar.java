package com.datatoexcel.converter.cli.output;

import java.io.PrintStream;

import com.datatoexcel.converter.convert.ProgressListener;

/**
 * Single-line progress bar, redrawn in place: {@code progress: |---   |}.
 * One dash per emitted table.
 */
public class ConsoleProgressBar implements ProgressListener {

    private final PrintStream out;

    public ConsoleProgressBar(PrintStream out) {
        this.out = out;
    }

    @Override
    public void started(int total) {
        draw(0, total);
    }

    @Override
    public void advanced(int done, int total) {
        draw(done, total);
    }

    @Override
    public void finished() {
        out.println();
        out.flush();
    }

    static String render(int done, int total) {
        int filled = Math.max(0, Math.min(done, total));
        return "progress: |" + "-".repeat(filled) + " ".repeat(total - filled) + "|";
    }

    private void draw(int done, int total) {
        out.print(render(done, total) + "\r");
        out.flush();
    }
}
