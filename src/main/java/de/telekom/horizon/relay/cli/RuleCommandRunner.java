// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.cli;

import de.telekom.horizon.relay.exception.RuleStoreException;
import de.telekom.horizon.relay.model.RelayRule;
import de.telekom.horizon.relay.store.RuleStore;
import de.telekom.horizon.relay.utils.AuthHeaders;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * The {@code RuleCommandRunner} manages relay rules from the command line instead of running the relay.
 *
 * <pre>
 * add    --server=URL --topic=NAME --webhook=URL [--basic=USER:PASS | --token=TOKEN]
 * remove --id=N
 * list
 * </pre>
 *
 * The exit code is 0 on success, 1 if the command failed and 2 for unknown commands.
 */
@Slf4j
@Component
@ConditionalOnProperty(value = "relay.mode", havingValue = "cli")
public class RuleCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = """
            Usage:
              add    --server=URL --topic=NAME --webhook=URL [--basic=USER:PASS | --token=TOKEN]
              remove --id=N
              list""";

    private static final int WEBHOOK_DISPLAY_LENGTH = 30;

    private static final String ROW_FORMAT = "%4s  %-30s  %-20s  %-33s  %s%n";

    private final RuleStore ruleStore;

    private final PrintStream out;

    private int exitCode;

    @Autowired
    public RuleCommandRunner(RuleStore ruleStore) {
        this(ruleStore, System.out);
    }

    public RuleCommandRunner(RuleStore ruleStore, PrintStream out) {
        this.ruleStore = ruleStore;
        this.out = out;
    }

    /**
     * Any leading argument that is not a {@code --} option selects command mode, unknown words included,
     * so a mistyped command ends with the usage text instead of starting the relay.
     */
    public static boolean isCommand(String[] args) {
        return args != null && args.length > 0 && StringUtils.isNotBlank(args[0]) && !args[0].startsWith("--");
    }

    @Override
    public void run(ApplicationArguments args) {
        var commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            out.println(USAGE);
            exitCode = 2;
            return;
        }

        try {
            exitCode = switch (commands.get(0)) {
                case "add" -> add(args);
                case "remove" -> remove(args);
                case "list" -> list();
                default -> {
                    out.println(USAGE);
                    yield 2;
                }
            };
        } catch (IllegalArgumentException illegalArgumentException) {
            out.println("Error: " + illegalArgumentException.getMessage());
            exitCode = 1;
        } catch (RuleStoreException ruleStoreException) {
            log.error("CLI error", ruleStoreException);
            out.println("Error: " + ruleStoreException.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int add(ApplicationArguments args) {
        var server = requireOption(args, "server");
        var topic = requireOption(args, "topic");
        var webhook = requireOption(args, "webhook");
        var authHeader = AuthHeaders.build(optionalOption(args, "basic"), optionalOption(args, "token"));

        var added = ruleStore.add(server, topic, webhook, authHeader);
        if (added.isEmpty()) {
            out.printf("Mapping %s/%s -> %s already exists.%n", server, topic, webhook);
            return 1;
        }

        out.printf("Added mapping with ID %d.%n", added.get().id());
        return 0;
    }

    private int remove(ApplicationArguments args) {
        var rawId = requireOption(args, "id");

        long id;
        try {
            id = Long.parseLong(rawId);
        } catch (NumberFormatException numberFormatException) {
            throw new IllegalArgumentException("--id must be a number but was '" + rawId + "'");
        }

        if (!ruleStore.remove(id)) {
            out.printf("No mapping with ID %d.%n", id);
            return 1;
        }

        out.printf("Removed mapping with ID %d.%n", id);
        return 0;
    }

    private int list() {
        var rules = ruleStore.list();
        if (rules.isEmpty()) {
            out.println("No active mappings.");
            return 0;
        }

        out.println("Active Ntfy -> Discord Mappings");
        out.printf(ROW_FORMAT, "ID", "Ntfy Server", "Ntfy Topic", "Discord Webhook", "Auth");
        for (RelayRule rule : rules) {
            out.printf(ROW_FORMAT, rule.id(), rule.sourceEndpoint(), rule.sourceTopic(),
                    StringUtils.left(rule.destinationEndpoint(), WEBHOOK_DISPLAY_LENGTH) + "...", rule.describeAuth());
        }
        return 0;
    }

    private String requireOption(ApplicationArguments args, String name) {
        var value = optionalOption(args, name);
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("Missing required option --" + name);
        }
        return value;
    }

    private String optionalOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}
