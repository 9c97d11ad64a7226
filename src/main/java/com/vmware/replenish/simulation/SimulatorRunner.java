/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.simulation;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.replenish.controller.RollingHorizonController;
import com.vmware.replenish.optimizer.OptimizerConfig;
import com.vmware.replenish.optimizer.OrToolsSolver;
import com.vmware.replenish.optimizer.ReorderPointHeuristic;
import com.vmware.replenish.optimizer.Solver;
import com.vmware.replenish.store.PolicyStore;

public class SimulatorRunner {
    // Network size
    private static final String NUM_PRODUCTS_OPTION = "numProducts";
    private static final int NUM_PRODUCTS_DEFAULT = 10;
    private static final String NUM_LOCATIONS_OPTION = "numLocations";
    private static final int NUM_LOCATIONS_DEFAULT = 4;

    // Planning
    private static final String HORIZON_OPTION = "horizon";
    private static final int HORIZON_DEFAULT = 7;
    private static final String CYCLES_OPTION = "cycles";
    private static final int CYCLES_DEFAULT = 14;
    private static final String PARTITION_SIZE_OPTION = "partitionSize";
    private static final int PARTITION_SIZE_DEFAULT = 20;

    // Solver
    private static final String SOLVER_OPTION = "solver";
    private static final String SOLVER_DEFAULT = "MILP";
    private static final String TIME_LIMIT_OPTION = "timeLimit";
    private static final long TIME_LIMIT_DEFAULT = 10_000;
    private static final String WORKERS_OPTION = "workers";
    private static final int WORKERS_DEFAULT = 4;

    // Random seed, used for debugging
    private static final String RANDOM_SEED_OPTION = "randomSeed";

    private static void print_help(final Options options) {
        final HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("java -cp target/replenish-optimizer-1.0.0-SNAPSHOT-jar-with-dependencies.jar "
                + "com.vmware.replenish.simulation.SimulatorRunner [options]", options);
    }

    public static void main(final String[] args) throws Exception {

        // These are the defaults for these parameters.
        // They should be overridden by commandline arguments.
        int numProducts = NUM_PRODUCTS_DEFAULT;
        int numLocations = NUM_LOCATIONS_DEFAULT;
        int horizon = HORIZON_DEFAULT;
        int cycles = CYCLES_DEFAULT;
        int partitionSize = PARTITION_SIZE_DEFAULT;
        String solverName = SOLVER_DEFAULT;
        long timeLimit = TIME_LIMIT_DEFAULT;
        int workers = WORKERS_DEFAULT;
        Integer randomSeed = null;

        final Logger log = LogManager.getLogger(Simulation.class);

        // create Options object
        final Options options = new Options();

        final Option helpOption = Option.builder("h")
                .longOpt("help").argName("h")
                .hasArg(false)
                .desc("print help message")
                .build();
        final Option numProductsOption = Option.builder("p")
                .longOpt(NUM_PRODUCTS_OPTION).argName(NUM_PRODUCTS_OPTION)
                .hasArg()
                .desc(String.format("number of products stocked at every location.%nDefault: %d",
                        NUM_PRODUCTS_DEFAULT))
                .type(Integer.class)
                .build();
        final Option numLocationsOption = Option.builder("l")
                .longOpt(NUM_LOCATIONS_OPTION).argName(NUM_LOCATIONS_OPTION)
                .hasArg()
                .desc(String.format("number of locations.%nDefault: %d", NUM_LOCATIONS_DEFAULT))
                .type(Integer.class)
                .build();
        final Option horizonOption = Option.builder("H")
                .longOpt(HORIZON_OPTION).argName(HORIZON_OPTION)
                .hasArg()
                .desc(String.format("periods planned per cycle.%nDefault: %d", HORIZON_DEFAULT))
                .type(Integer.class)
                .build();
        final Option cyclesOption = Option.builder("c")
                .longOpt(CYCLES_OPTION).argName(CYCLES_OPTION)
                .hasArg()
                .desc(String.format("number of cycles to simulate.%nDefault: %d", CYCLES_DEFAULT))
                .type(Integer.class)
                .build();
        final Option partitionSizeOption = Option.builder("k")
                .longOpt(PARTITION_SIZE_OPTION).argName(PARTITION_SIZE_OPTION)
                .hasArg()
                .desc(String.format("maximum (product, location) pairs per partition.%nDefault: %d",
                        PARTITION_SIZE_DEFAULT))
                .type(Integer.class)
                .build();
        final Option solverOption = Option.builder("s")
                .longOpt(SOLVER_OPTION).argName(SOLVER_OPTION)
                .hasArg()
                .desc(String.format("solver (MILP | ROP).%nDefault: %s", SOLVER_DEFAULT))
                .type(String.class)
                .build();
        final Option timeLimitOption = Option.builder("t")
                .longOpt(TIME_LIMIT_OPTION).argName(TIME_LIMIT_OPTION)
                .hasArg()
                .desc(String.format("solve time limit per partition in milliseconds.%nDefault: %d",
                        TIME_LIMIT_DEFAULT))
                .type(Long.class)
                .build();
        final Option workersOption = Option.builder("w")
                .longOpt(WORKERS_OPTION).argName(WORKERS_OPTION)
                .hasArg()
                .desc(String.format("number of partitions solved in parallel.%nDefault: %d", WORKERS_DEFAULT))
                .type(Integer.class)
                .build();
        final Option randomSeedOption = Option.builder("r")
                .longOpt(RANDOM_SEED_OPTION).argName(RANDOM_SEED_OPTION)
                .hasArg()
                .desc("Optional: seed for random.")
                .type(Integer.class)
                .build();

        options.addOption(helpOption);
        options.addOption(numProductsOption);
        options.addOption(numLocationsOption);
        options.addOption(horizonOption);
        options.addOption(cyclesOption);
        options.addOption(partitionSizeOption);
        options.addOption(solverOption);
        options.addOption(timeLimitOption);
        options.addOption(workersOption);
        options.addOption(randomSeedOption);

        final CommandLineParser parser = new DefaultParser();
        try {
            final CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption("h")) {
                // automatically generate the help statement
                print_help(options);
                return;
            }
            if (cmd.hasOption(NUM_PRODUCTS_OPTION)) {
                numProducts = Integer.parseInt(cmd.getOptionValue(NUM_PRODUCTS_OPTION));
                if (numProducts <= 0) {
                    log.error("Number of products must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(NUM_LOCATIONS_OPTION)) {
                numLocations = Integer.parseInt(cmd.getOptionValue(NUM_LOCATIONS_OPTION));
                if (numLocations <= 0) {
                    log.error("Number of locations must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(HORIZON_OPTION)) {
                horizon = Integer.parseInt(cmd.getOptionValue(HORIZON_OPTION));
                if (horizon <= 0) {
                    log.error("Horizon must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(CYCLES_OPTION)) {
                cycles = Integer.parseInt(cmd.getOptionValue(CYCLES_OPTION));
                if (cycles <= 0) {
                    log.error("Number of cycles must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(PARTITION_SIZE_OPTION)) {
                partitionSize = Integer.parseInt(cmd.getOptionValue(PARTITION_SIZE_OPTION));
                if (partitionSize <= 0) {
                    log.error("Partition size must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(SOLVER_OPTION)) {
                solverName = cmd.getOptionValue(SOLVER_OPTION);
                if (!solverName.equals("MILP") && !solverName.equals("ROP")) {
                    log.error("Solver must be (case sensitive) 'MILP'|'ROP' but is '{}'", solverName);
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(TIME_LIMIT_OPTION)) {
                timeLimit = Long.parseLong(cmd.getOptionValue(TIME_LIMIT_OPTION));
                if (timeLimit <= 0) {
                    log.error("Time limit must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(WORKERS_OPTION)) {
                workers = Integer.parseInt(cmd.getOptionValue(WORKERS_OPTION));
                if (workers <= 0) {
                    log.error("Number of workers must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(RANDOM_SEED_OPTION)) {
                randomSeed = Integer.parseInt(cmd.getOptionValue(RANDOM_SEED_OPTION));
            }
        } catch (final ParseException | NumberFormatException e) {
            log.error("Failed to parse command line: {}", e.getMessage());
            print_help(options);
            return;
        }

        final OptimizerConfig.Builder configBuilder = new OptimizerConfig.Builder()
                .setTimeLimitMillis(timeLimit)
                .setWorkers(workers);
        if (randomSeed != null) {
            configBuilder.setRandomSeed(randomSeed);
        }
        final OptimizerConfig config = configBuilder.build();

        final ReorderPointHeuristic heuristic = new ReorderPointHeuristic();
        final Solver solver = solverName.equals("ROP") ? heuristic : new OrToolsSolver(config);
        final PolicyStore store = new PolicyStore();
        final RollingHorizonController controller = new RollingHorizonController(config, solver, heuristic, store);

        System.out.println(String.format("Simulation setup: solver=%s, products=%d, locations=%d, horizon=%d, "
                + "cycles=%d, partitionSize=%d, timeLimit=%d, workers=%d, randomSeed=%d", solverName, numProducts,
                numLocations, horizon, cycles, partitionSize, timeLimit, workers, randomSeed));

        final Simulation simulation = new Simulation(controller, config, randomSeed, numProducts, numLocations,
                horizon, cycles, partitionSize);
        final SimulationSummary summary = simulation.run(cycles);

        // Print final stats
        store.printStats("cycle-" + (cycles - 1));
        System.out.println(summary);
        log.info("Simulation complete");
    }
}
