package mirage.ai.training;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.stream.JsonWriter;

import mirage.ai.env.ActionCatalog;

/**
 * Exports training rollouts as JSONL: one {@code "step"} line per
 * collected step followed by one {@code "episode"} line with the
 * episode's total and update statistics. The file is created on the first
 * record, so a run that is cancelled before its first episode leaves
 * nothing behind.
 */
public class TrajectoryWriter implements Closeable {
    private final Path outputFile;
    private final ActionCatalog catalog;
    private BufferedWriter fileWriter;
    private boolean closed;

    public TrajectoryWriter(Path outputFile, ActionCatalog catalog) {
        this.outputFile = outputFile;
        this.catalog = catalog;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    private void ensureOpen() throws IOException {
        if (fileWriter == null) {
            Path dir = outputFile.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            fileWriter = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8);
        }
    }

    public synchronized void recordEpisode(int episode, Trajectory trajectory, UpdateStats stats) {
        if (closed) {
            return;
        }
        try {
            ensureOpen();
            for (int i = 0; i < trajectory.size(); i++) {
                writeLine(stepJson(episode, i, trajectory.get(i)));
            }

            StringWriter sw = new StringWriter(256);
            JsonWriter jw = new JsonWriter(sw);
            jw.beginObject();
            jw.name("type").value("episode");
            jw.name("episode").value(episode);
            jw.name("length").value(trajectory.size());
            jw.name("totalReward").value(trajectory.totalReward());
            if (Double.isFinite(stats.getTotalLoss())) {
                jw.name("policyLoss").value(stats.getPolicyLoss());
                jw.name("valueLoss").value(stats.getValueLoss());
                jw.name("entropy").value(stats.getEntropy());
                jw.name("clipFraction").value(stats.getClipFraction());
            }
            jw.name("skippedSteps").value(stats.getSkippedSteps());
            jw.endObject();
            jw.close();
            writeLine(sw.toString());
            fileWriter.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write trajectory export " + outputFile, e);
        }
    }

    private String stepJson(int episode, int index, Trajectory.Step step) throws IOException {
        StringWriter sw = new StringWriter(512);
        JsonWriter jw = new JsonWriter(sw);
        jw.beginObject();
        jw.name("type").value("step");
        jw.name("episode").value(episode);
        jw.name("step").value(index);
        jw.name("state");
        jw.beginArray();
        for (double v : step.getState()) {
            jw.value(v);
        }
        jw.endArray();
        jw.name("action").value(step.getAction());
        jw.name("actionLabel").value(catalog.get(step.getAction()).getLabel());
        jw.name("logProb").value(step.getLogProb());
        jw.name("value").value(step.getValue());
        jw.name("reward").value(step.getReward());
        jw.name("done").value(step.isDone());
        jw.endObject();
        jw.close();
        return sw.toString();
    }

    private void writeLine(String json) throws IOException {
        fileWriter.write(json);
        fileWriter.newLine();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (fileWriter == null) {
            return;
        }
        try {
            fileWriter.close();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to close trajectory export " + outputFile, e);
        }
    }
}
