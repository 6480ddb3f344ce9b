/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.shardwarden.master.provision;

import dev.mars.shardwarden.master.config.MailSettings;
import dev.mars.shardwarden.security.ShardIdentity;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sends notifications by piping a rendered template into an external mail
 * command. With mail disabled, notifications are only logged.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class MailCommandNotifier implements OperatorNotifier {

    private static final Logger logger = LoggerFactory.getLogger(MailCommandNotifier.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    private static final long MAIL_TIMEOUT_MS = 60_000;

    private final WorkerExecutor executor;
    private final Supplier<MailSettings> settings;
    private final long timeoutMs;

    public MailCommandNotifier(Vertx vertx, Supplier<MailSettings> settings) {
        this(vertx, settings, MAIL_TIMEOUT_MS);
    }

    MailCommandNotifier(Vertx vertx, Supplier<MailSettings> settings, long timeoutMs) {
        this.executor = vertx.createSharedWorkerExecutor("shardwarden-mail", 2);
        this.settings = settings;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void identityCreated(ShardIdentity identity, Path artifact) {
        MailSettings mail = settings.get();
        logger.info("Created identity {} at {}; deploy it to a new shard", identity.id(), artifact);
        if (!mail.enabled()) {
            return;
        }
        String body = render(mail.createMessage(), identity.id(), identity.pubKey(), null);
        List<String> args = new ArrayList<>();
        for (String arg : mail.args()) {
            args.add(MailSettings.ATTACHMENT_PLACEHOLDER.equals(arg) ? artifact.toString() : arg);
        }
        send(mail.command(), args, body);
    }

    @Override
    public void identityFailed(String summary, Throwable cause) {
        MailSettings mail = settings.get();
        logger.error("Failed to create shard identity: {}", summary, cause);
        if (!mail.enabled()) {
            return;
        }
        send(mail.command(), mail.failArgs(), render(mail.createFailMessage(), null, null, errors(summary, cause)));
    }

    static String render(String template, String id, String pubKey, String errors) {
        if (template == null) {
            return "";
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String value;
            switch (name) {
                case "date" -> value = ZonedDateTime.now().format(DateTimeFormatter.RFC_1123_DATE_TIME);
                case "id" -> value = id != null ? id : name;
                case "pubkey" -> value = pubKey != null ? pubKey : name;
                case "errors" -> value = errors != null ? errors : name;
                default -> value = name;
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String errors(String summary, Throwable cause) {
        if (cause == null) {
            return summary;
        }
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        return summary + "\n\n===== ERROR SPLIT =====\n\n" + trace;
    }

    /**
     * Runs the mail command on the notifier's own worker, so a slow mailer
     * never delays registry writes queued on the verticle context. Output is
     * discarded; the wait is bounded by the mail timeout.
     *
     * @return the command's exit code
     */
    Future<Integer> send(String command, List<String> args, String stdin) {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        commandLine.addAll(args);
        return executor.<Integer>executeBlocking(() -> {
            Process process = new ProcessBuilder(commandLine)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            try (OutputStream in = process.getOutputStream()) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                logger.debug("Mail command closed its input early: {}", e.getMessage());
            }
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Mail command did not finish within " + timeoutMs + "ms");
            }
            return process.exitValue();
        }, false).onSuccess(code -> {
            if (code != 0) {
                logger.warn("Mail command exited with {}", code);
            } else {
                logger.debug("Mail sent");
            }
        }).onFailure(err -> logger.error("Failed to run mail command {}: {}", command, err.getMessage()));
    }

    public Future<Void> close() {
        return executor.close();
    }
}
