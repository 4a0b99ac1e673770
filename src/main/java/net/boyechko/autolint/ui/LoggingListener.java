/*
 * Auto-Lint - Rule-Based Linting and Formatting for Markup and Type Declarations
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.autolint.ui;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.List;
import net.boyechko.autolint.core.LintListener;
import net.boyechko.autolint.core.LintResult;
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;
import net.boyechko.autolint.diagnostic.MessageCatalog;
import net.boyechko.autolint.diagnostic.YamlMessageCatalog;
import net.boyechko.autolint.traverse.QueuedEdit;
import org.slf4j.LoggerFactory;

/** A {@link LintListener} that routes all events through SLF4J. */
public class LoggingListener implements LintListener {

    static final String CONSOLE_APPENDER_NAME = "AUTOLINT_CONSOLE";
    static final String LOGGER_NAME = "net.boyechko.autolint.run";

    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    private final MessageCatalog catalog;

    public LoggingListener() {
        this(YamlMessageCatalog.loadDefault());
    }

    public LoggingListener(MessageCatalog catalog) {
        this.catalog = catalog;
    }

    /** Creates a {@link LoggingListener} and ensures logs are emitted to stdout. */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-20logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onTargetStart(String name) {
        logger.info("TARGET {}", name);
    }

    @Override
    public void onPassStart(int pass) {
        logger.debug("PASS {}", pass);
    }

    @Override
    public void onDiagnostic(Diagnostic diagnostic) {
        String fixable = diagnostic.hasFix() ? " (fixable)" : "";
        logger.warn(
                "{} at {}: {}{}",
                diagnostic.category().id(),
                diagnostic.location(),
                catalog.describe(diagnostic),
                fixable);
    }

    @Override
    public void onDiagnosticGroup(DiagnosticCategory category, List<Diagnostic> diagnostics) {
        logger.warn(
                "{} x{}: {}",
                category.id(),
                diagnostics.size(),
                catalog.describe(diagnostics.get(0)));
        for (Diagnostic diagnostic : diagnostics) {
            logger.debug("  at {}", diagnostic.location());
        }
    }

    @Override
    public void onFixApplied(QueuedEdit edit) {
        logger.info("FIXED {} by {}", edit.location(), String.join(", ", edit.ruleNames()));
    }

    @Override
    public void onWarning(String message) {
        logger.warn("{}", message);
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onSummary(LintResult result) {
        logger.info(
                "SUMMARY detected={} fixable={} applied={} remaining={}",
                result.totalDetected(),
                result.totalFixable(),
                result.totalApplied(),
                result.totalRemaining());
    }
}
