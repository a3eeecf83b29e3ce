package mirage.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ProgressBarTest {

    @Test
    public void testBarFill() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        ProgressBar bar = new ProgressBar(new PrintStream(buf, true, StandardCharsets.UTF_8), 10, 10);
        Assert.assertEquals(bar.renderBar(), "[>         ]");
        bar.update(5, 1.25);
        Assert.assertEquals(bar.getCurrent(), 5);
        Assert.assertEquals(bar.renderBar(), "[#####>    ]");
        bar.update(10, -0.5);
        Assert.assertEquals(bar.renderBar(), "[##########]");

        String printed = new String(buf.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(printed.contains("10/10"), printed);
        Assert.assertTrue(printed.contains("reward -0.50"), printed);
    }

    @Test
    public void testFormatDuration() {
        Assert.assertEquals(ProgressBar.formatDuration(5_000), "0:05");
        Assert.assertEquals(ProgressBar.formatDuration(65_000), "1:05");
        Assert.assertEquals(ProgressBar.formatDuration(3_723_000), "1:02:03");
    }
}
