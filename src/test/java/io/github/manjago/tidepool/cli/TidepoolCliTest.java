package io.github.manjago.tidepool.cli;

import io.github.manjago.tidepool.config.SimulatorConfig;
import io.github.manjago.tidepool.persistence.CheckpointStore;
import io.github.manjago.tidepool.persistence.CheckpointStore.CheckpointData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TidepoolCliTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Info prints without error")
    void info() {
        assertEquals(0, TidepoolCli.execute("info"));
    }

    @Test
    @DisplayName("Unknown option is a usage error")
    void unknownOption() {
        assertNotEquals(0, TidepoolCli.execute("run", "--no-such-option"));
    }

    @Test
    @DisplayName("Run writes a checkpoint that can be resumed, inspected and compared")
    void runResumeAndDiff() throws IOException {
        Path first = tempDir.resolve("first.mv");
        Path second = tempDir.resolve("second.mv");
        Path replay = tempDir.resolve("replay.mv");

        assertEquals(0, TidepoolCli.execute("run", "-q", "-s", "42", "-t", "50", "-o", first.toString()));
        assertEquals(50, CheckpointStore.load(first).tick());

        assertEquals(0, TidepoolCli.execute("run", "-q", "-r", first.toString(), "-t", "20",
                "-o", second.toString()));
        assertEquals(70, CheckpointStore.load(second).tick());

        assertEquals(0, TidepoolCli.execute("checkpoint", "info", "-a", second.toString()));

        assertEquals(0, TidepoolCli.execute("run", "-q", "-s", "42", "-t", "50", "-o", replay.toString()));
        assertEquals(0, TidepoolCli.execute("checkpoint", "diff", first.toString(), replay.toString()));
        assertEquals(1, TidepoolCli.execute("checkpoint", "diff", first.toString(), second.toString()));
    }

    @Test
    @DisplayName("Diff names the fields that differ")
    void diffDetails() throws IOException {
        Path a = tempDir.resolve("a.mv");
        Path b = tempDir.resolve("b.mv");
        TidepoolCli.execute("run", "-q", "-s", "1", "-t", "30", "-o", a.toString());
        TidepoolCli.execute("run", "-q", "-s", "2", "-t", "30", "-o", b.toString());

        CheckpointData d1 = CheckpointStore.load(a);
        CheckpointData d2 = CheckpointStore.load(b);

        assertTrue(CheckpointCommand.DiffCommand.diff(d1, d1).isEmpty());
        assertTrue(CheckpointCommand.DiffCommand.diff(d1, d2).contains("seed: 1 vs 2"));
    }

    @Test
    @DisplayName("Missing checkpoint is reported, not thrown")
    void missingCheckpoint() {
        Path missing = tempDir.resolve("missing.mv");
        assertEquals(1, TidepoolCli.execute("checkpoint", "info", missing.toString()));
        assertEquals(1, TidepoolCli.execute("run", "-q", "-r", missing.toString()));
    }

    @Test
    @DisplayName("Command line overrides the configuration")
    void buildConfig() {
        RunCommand command = new RunCommand();
        new CommandLine(command).parseArgs("-m", "3", "-s", "9", "-n", "2", "--checkpoint-interval", "0");

        SimulatorConfig config = command.buildConfig();

        assertEquals(3, config.population().maxPopulation());
        assertEquals(2, config.population().criticalPopulation());
        assertEquals(9, config.seed());
        assertEquals(2, config.initialPopulation());
        assertEquals(0, config.checkpointInterval());
    }
}
