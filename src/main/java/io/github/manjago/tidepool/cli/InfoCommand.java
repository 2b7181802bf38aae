package io.github.manjago.tidepool.cli;

import io.github.manjago.tidepool.agent.LifeStage;
import io.github.manjago.tidepool.config.LifecycleSettings;
import io.github.manjago.tidepool.config.SimulatorConfig;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about Tidepool.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              TIDEPOOL                 ║");
        System.out.println("║     Fish Tank Life Simulator          ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        SimulatorConfig config = SimulatorConfig.defaults();
        System.out.println("Default Configuration:");
        System.out.println(config);

        LifecycleSettings lifecycle = config.lifecycle();
        System.out.println("Life stages (ages in ticks):");
        System.out.printf("  %-9s 0 .. %d%n", LifeStage.BABY, lifecycle.babyMaxAge() - 1);
        System.out.printf("  %-9s %d .. %d%n", LifeStage.JUVENILE, lifecycle.babyMaxAge(), lifecycle.juvenileMaxAge() - 1);
        System.out.printf("  %-9s %d .. %d%n", LifeStage.ADULT, lifecycle.juvenileMaxAge(), lifecycle.adultMaxAge() - 1);
        System.out.printf("  %-9s %d .. lifespan (%d for a plain genome)%n",
                LifeStage.ELDER, lifecycle.adultMaxAge(), lifecycle.baseMaxAge());
        System.out.println();

        return 0;
    }
}
