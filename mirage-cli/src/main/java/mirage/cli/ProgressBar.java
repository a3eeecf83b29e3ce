package mirage.cli;

import java.io.PrintStream;

/**
 * Carriage-return progress bar for stderr, with the latest episode reward.
 */
public class ProgressBar {
    private final PrintStream out;
    private final int total;
    private final int barWidth;
    private final long startTime;
    private int current;
    private double lastReward = Double.NaN;

    public ProgressBar(PrintStream out, int total) {
        this(out, total, 30);
    }

    public ProgressBar(PrintStream out, int total, int barWidth) {
        this.out = out;
        this.total = total;
        this.barWidth = barWidth;
        this.startTime = System.currentTimeMillis();
    }

    public synchronized void update(int completed, double reward) {
        this.current = completed;
        this.lastReward = reward;
        render();
    }

    int getCurrent() {
        return current;
    }

    String renderBar() {
        double fraction = total > 0 ? Math.min(1.0, (double) current / total) : 0;
        int filled = (int) (fraction * barWidth);
        StringBuilder bar = new StringBuilder(barWidth + 2);
        bar.append('[');
        for (int i = 0; i < barWidth; i++) {
            bar.append(i < filled ? '#' : (i == filled ? '>' : ' '));
        }
        bar.append(']');
        return bar.toString();
    }

    private void render() {
        double fraction = total > 0 ? (double) current / total : 0;
        String eta = "--:--";
        if (current > 0) {
            long elapsed = System.currentTimeMillis() - startTime;
            eta = formatDuration((long) (elapsed * (total - current) / (double) current));
        }
        String reward = Double.isNaN(lastReward) ? "" : String.format("  reward %+.2f", lastReward);
        out.printf("\r%s %3.0f%% %d/%d  ETA: %s%s", renderBar(), fraction * 100, current, total, eta, reward);
        out.flush();
    }

    /** Print the final state and move to the next line. */
    public synchronized void finish() {
        render();
        out.printf("  [%s]%n", formatDuration(System.currentTimeMillis() - startTime));
        out.flush();
    }

    static String formatDuration(long ms) {
        long secs = ms / 1000;
        if (secs < 60) {
            return String.format("0:%02d", secs);
        } else if (secs < 3600) {
            return String.format("%d:%02d", secs / 60, secs % 60);
        }
        return String.format("%d:%02d:%02d", secs / 3600, (secs % 3600) / 60, secs % 60);
    }
}
