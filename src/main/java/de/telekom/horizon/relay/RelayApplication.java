// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay;

import de.telekom.horizon.relay.cli.RuleCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RelayApplication {

    static final String CLI_PROFILE = "cli";

    public static void main(String[] args) {
        if (RuleCommandRunner.isCommand(args)) {
            var application = new SpringApplication(RelayApplication.class);
            application.setWebApplicationType(WebApplicationType.NONE);
            application.setAdditionalProfiles(CLI_PROFILE);

            System.exit(SpringApplication.exit(application.run(args)));
        }

        SpringApplication.run(RelayApplication.class, args);
    }

}
