/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

import java.nio.file.Path;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.replenish.ingest.SnapshotReader;
import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.Policy;
import com.vmware.replenish.optimizer.OptimizerConfig;
import com.vmware.replenish.optimizer.OrToolsSolver;
import com.vmware.replenish.optimizer.ReorderPointHeuristic;
import com.vmware.replenish.optimizer.ValidationException;
import com.vmware.replenish.store.PolicyStore;

/**
 * Runs one planning cycle over a JSON snapshot and prints the resulting policies.
 */
public class PlannerRunner {
    private static final String INPUT_OPTION = "input";

    private static final String START_PERIOD_OPTION = "startPeriod";
    private static final int START_PERIOD_DEFAULT = 0;
    private static final String HORIZON_OPTION = "horizon";
    private static final int HORIZON_DEFAULT = 7;
    private static final String CYCLE_ID_OPTION = "cycleId";
    private static final String CYCLE_ID_DEFAULT = "cycle-0";
    private static final String PARTITION_SIZE_OPTION = "partitionSize";
    private static final int PARTITION_SIZE_DEFAULT = 50;

    private static final String BACKEND_OPTION = "backend";
    private static final String BACKEND_DEFAULT = "SCIP";
    private static final String TIME_LIMIT_OPTION = "timeLimit";
    private static final long TIME_LIMIT_DEFAULT = 10_000;
    private static final String GAP_OPTION = "gap";
    private static final double GAP_DEFAULT = 1e-4;
    private static final String WORKERS_OPTION = "workers";
    private static final String SAFETY_STOCK_OPTION = "safetyStock";
    private static final String GRANULARITY_OPTION = "granularity";
    private static final double GRANULARITY_DEFAULT = 1.0;
    private static final String INTEGER_ORDERS_OPTION = "integerOrders";
    private static final String RANDOM_SEED_OPTION = "randomSeed";

    private static void print_help(final Options options) {
        final HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("java -jar target/replenish-optimizer-1.0.0-SNAPSHOT-jar-with-dependencies.jar "
                + "-i snapshot.json [options]", options);
    }

    private static Options options() {
        final Options options = new Options();
        options.addOption(Option.builder("h")
                .longOpt("help").argName("h")
                .hasArg(false)
                .desc("print help message")
                .build());
        options.addOption(Option.builder("i")
                .longOpt(INPUT_OPTION).argName(INPUT_OPTION)
                .hasArg()
                .desc("JSON snapshot with products, locations, forecasts, risk_events and inventory.")
                .type(String.class)
                .build());
        options.addOption(Option.builder("s")
                .longOpt(START_PERIOD_OPTION).argName(START_PERIOD_OPTION)
                .hasArg()
                .desc(String.format("first period of the horizon.%nDefault: %d", START_PERIOD_DEFAULT))
                .type(Integer.class)
                .build());
        options.addOption(Option.builder("H")
                .longOpt(HORIZON_OPTION).argName(HORIZON_OPTION)
                .hasArg()
                .desc(String.format("number of periods to plan.%nDefault: %d", HORIZON_DEFAULT))
                .type(Integer.class)
                .build());
        options.addOption(Option.builder("c")
                .longOpt(CYCLE_ID_OPTION).argName(CYCLE_ID_OPTION)
                .hasArg()
                .desc(String.format("identifier of the cycle.%nDefault: %s", CYCLE_ID_DEFAULT))
                .type(String.class)
                .build());
        options.addOption(Option.builder("k")
                .longOpt(PARTITION_SIZE_OPTION).argName(PARTITION_SIZE_OPTION)
                .hasArg()
                .desc(String.format("maximum (product, location) pairs per partition.%nDefault: %d",
                        PARTITION_SIZE_DEFAULT))
                .type(Integer.class)
                .build());
        options.addOption(Option.builder("b")
                .longOpt(BACKEND_OPTION).argName(BACKEND_OPTION)
                .hasArg()
                .desc(String.format("OR-tools linear solver backend (SCIP | CBC | ...).%nDefault: %s",
                        BACKEND_DEFAULT))
                .type(String.class)
                .build());
        options.addOption(Option.builder("t")
                .longOpt(TIME_LIMIT_OPTION).argName(TIME_LIMIT_OPTION)
                .hasArg()
                .desc(String.format("solve time limit per partition in milliseconds.%nDefault: %d",
                        TIME_LIMIT_DEFAULT))
                .type(Long.class)
                .build());
        options.addOption(Option.builder("g")
                .longOpt(GAP_OPTION).argName(GAP_OPTION)
                .hasArg()
                .desc(String.format("relative MIP gap tolerance.%nDefault: %s", GAP_DEFAULT))
                .type(Double.class)
                .build());
        options.addOption(Option.builder("w")
                .longOpt(WORKERS_OPTION).argName(WORKERS_OPTION)
                .hasArg()
                .desc(String.format("number of partitions solved in parallel.%nDefault: available processors"))
                .type(Integer.class)
                .build());
        options.addOption(Option.builder("m")
                .longOpt(SAFETY_STOCK_OPTION).argName(SAFETY_STOCK_OPTION)
                .hasArg()
                .desc(String.format("safety stock method (NORMAL_APPROXIMATION | EMPIRICAL_QUANTILE).%nDefault: %s",
                        OptimizerConfig.SafetyStockMethod.NORMAL_APPROXIMATION))
                .type(String.class)
                .build());
        options.addOption(Option.builder("u")
                .longOpt(GRANULARITY_OPTION).argName(GRANULARITY_OPTION)
                .hasArg()
                .desc(String.format("order quantities are rounded to multiples of this.%nDefault: %s",
                        GRANULARITY_DEFAULT))
                .type(Double.class)
                .build());
        options.addOption(Option.builder("n")
                .longOpt(INTEGER_ORDERS_OPTION).argName(INTEGER_ORDERS_OPTION)
                .hasArg(false)
                .desc("model order quantities as integers.")
                .build());
        options.addOption(Option.builder("r")
                .longOpt(RANDOM_SEED_OPTION).argName(RANDOM_SEED_OPTION)
                .hasArg()
                .desc("Optional: seed for the solver backend.")
                .type(Integer.class)
                .build());
        return options;
    }

    public static void main(final String[] args) throws Exception {
        final Logger log = LogManager.getLogger(PlannerRunner.class);
        final Options options = options();

        String input = null;
        int startPeriod = START_PERIOD_DEFAULT;
        int horizonLength = HORIZON_DEFAULT;
        String cycleId = CYCLE_ID_DEFAULT;
        int partitionSize = PARTITION_SIZE_DEFAULT;
        final OptimizerConfig.Builder configBuilder = new OptimizerConfig.Builder()
                .setBackend(BACKEND_DEFAULT)
                .setTimeLimitMillis(TIME_LIMIT_DEFAULT)
                .setGapTolerance(GAP_DEFAULT)
                .setOrderGranularity(GRANULARITY_DEFAULT);

        final CommandLineParser parser = new DefaultParser();
        final OptimizerConfig config;
        try {
            final CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption("h")) {
                // automatically generate the help statement
                print_help(options);
                return;
            }
            if (!cmd.hasOption(INPUT_OPTION)) {
                log.error("An input snapshot is required");
                print_help(options);
                return;
            }
            input = cmd.getOptionValue(INPUT_OPTION);
            if (cmd.hasOption(START_PERIOD_OPTION)) {
                startPeriod = Integer.parseInt(cmd.getOptionValue(START_PERIOD_OPTION));
            }
            if (cmd.hasOption(HORIZON_OPTION)) {
                horizonLength = Integer.parseInt(cmd.getOptionValue(HORIZON_OPTION));
                if (horizonLength <= 0) {
                    log.error("Horizon must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(CYCLE_ID_OPTION)) {
                cycleId = cmd.getOptionValue(CYCLE_ID_OPTION);
            }
            if (cmd.hasOption(PARTITION_SIZE_OPTION)) {
                partitionSize = Integer.parseInt(cmd.getOptionValue(PARTITION_SIZE_OPTION));
                if (partitionSize <= 0) {
                    log.error("Partition size must be > 0");
                    print_help(options);
                    return;
                }
            }
            if (cmd.hasOption(BACKEND_OPTION)) {
                configBuilder.setBackend(cmd.getOptionValue(BACKEND_OPTION));
            }
            if (cmd.hasOption(TIME_LIMIT_OPTION)) {
                configBuilder.setTimeLimitMillis(Long.parseLong(cmd.getOptionValue(TIME_LIMIT_OPTION)));
            }
            if (cmd.hasOption(GAP_OPTION)) {
                configBuilder.setGapTolerance(Double.parseDouble(cmd.getOptionValue(GAP_OPTION)));
            }
            if (cmd.hasOption(WORKERS_OPTION)) {
                configBuilder.setWorkers(Integer.parseInt(cmd.getOptionValue(WORKERS_OPTION)));
            }
            if (cmd.hasOption(SAFETY_STOCK_OPTION)) {
                configBuilder.setSafetyStockMethod(
                        OptimizerConfig.SafetyStockMethod.valueOf(cmd.getOptionValue(SAFETY_STOCK_OPTION)));
            }
            if (cmd.hasOption(GRANULARITY_OPTION)) {
                configBuilder.setOrderGranularity(Double.parseDouble(cmd.getOptionValue(GRANULARITY_OPTION)));
            }
            if (cmd.hasOption(INTEGER_ORDERS_OPTION)) {
                configBuilder.setIntegerOrders(true);
            }
            if (cmd.hasOption(RANDOM_SEED_OPTION)) {
                configBuilder.setRandomSeed(Integer.parseInt(cmd.getOptionValue(RANDOM_SEED_OPTION)));
            }
            config = configBuilder.build();
        } catch (final ParseException | IllegalArgumentException e) {
            log.error("Failed to parse command line: {}", e.getMessage());
            print_help(options);
            return;
        }

        final PlanningSnapshot snapshot;
        try {
            snapshot = new SnapshotReader().read(Path.of(input));
        } catch (final ValidationException e) {
            log.error("Invalid snapshot {}: {}", input, e.getMessage());
            System.exit(-1);
            return;
        }

        final Horizon horizon = new Horizon(startPeriod, horizonLength);
        final List<Partition> partitions = Partitioner.byLocation(snapshot, horizon, partitionSize);
        final PolicyStore store = new PolicyStore();
        final RollingHorizonController controller = new RollingHorizonController(config,
                new OrToolsSolver(config), new ReorderPointHeuristic(), store);
        log.info("Planning with {}", config);

        int exitCode = 0;
        try {
            controller.runCycle(new CycleContext(cycleId, horizon, snapshot, partitions));
        } catch (final PartialBatchFailureException e) {
            log.error(e.getMessage());
            exitCode = 1;
        }

        System.out.println("product_id,location_id,period,order_quantity,safety_stock,reorder_point,"
                + "solver_status,objective_value,resolution");
        for (final Policy policy : store.policiesForCycle(cycleId)) {
            System.out.println(String.format("%s,%s,%d,%s,%s,%s,%s,%s,%s", policy.productId(), policy.locationId(),
                    policy.period(), policy.orderQuantity(), policy.safetyStock(), policy.reorderPoint(),
                    policy.solverStatus(), policy.objectiveValue(), policy.resolution()));
        }
        store.printStats(cycleId);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
