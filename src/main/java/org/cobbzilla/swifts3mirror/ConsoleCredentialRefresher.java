package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Asks the operator for a new set of AWS session credentials. Secrets are not echoed when a console is attached.
 */
@Slf4j
public class ConsoleCredentialRefresher implements CredentialRefresher {

    private final BufferedReader reader;
    private final PrintStream prompt;

    public ConsoleCredentialRefresher() {
        this(new BufferedReader(new InputStreamReader(System.in, UTF_8)), System.out);
    }

    public ConsoleCredentialRefresher(BufferedReader reader, PrintStream prompt) {
        this.reader = reader;
        this.prompt = prompt;
    }

    @Override
    public synchronized MirrorCredentials refresh() {
        final String accessKeyId = read("Enter AWS Access Key ID: ", false);
        final String secretKey = read("Enter AWS Secret Access Key: ", true);
        final String sessionToken = read("Enter AWS Session Token: ", true);

        final MirrorCredentials credentials = new MirrorCredentials(accessKeyId, secretKey, sessionToken);
        if (!credentials.isComplete()) throw new StoreException("Incomplete AWS credentials entered");
        log.info("Received new AWS credentials for access key {}.", accessKeyId);
        return credentials;
    }

    private String read(String label, boolean secret) {
        final Console console = System.console();
        if (console != null) {
            if (secret) {
                final char[] value = console.readPassword(label);
                return value == null ? null : new String(value).trim();
            }
            final String value = console.readLine(label);
            return value == null ? null : value.trim();
        }
        prompt.print(label);
        prompt.flush();
        try {
            final String line = reader.readLine();
            if (line == null) throw new StoreException("No more input while reading AWS credentials");
            return line.trim();
        } catch (IOException e) {
            throw new StoreException("Could not read AWS credentials", e);
        }
    }
}
