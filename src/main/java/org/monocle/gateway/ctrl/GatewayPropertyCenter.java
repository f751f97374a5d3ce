/***********************************************************************
 * This file is part of Monocle Gateway.
 *
 * Monocle Gateway is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Monocle Gateway is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Monocle Gateway.  If not, see <http://www.gnu.org/licenses/>.
 ************************************************************************/

package org.monocle.gateway.ctrl;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.commons.cli.*;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Level;
import org.monocle.gateway.util.logging.ConsoleLogger;
import org.monocle.gateway.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map.Entry;

/**
 * The GatewayPropertyCenter class is responsible of managing the properties
 * of the gateway. There are some properties predefined, and they can be
 * overwritten by a JSON configuration file and by command options.
 * <p>
 * Without a --config-file option, the configuration is looked up at
 * ~/.monocle/config.json, then at ./config.json.
 */
public class GatewayPropertyCenter {

    public static final String DEFAULT_API_URI = "wss://api.monoclecam.com/v1";

    /* Logger for parsing */
    protected Logger logger = new ConsoleLogger(Level.INFO);

    /* Remote API properties */
    public String apiToken = null;
    public String apiUri = DEFAULT_API_URI;
    /* Delay between a lost remote session and the next attempt, in milliseconds. */
    public long reconnectInterval = 60000;
    /* Local control server properties */
    public int port = 8080;
    /* Credentials for cameras whose source carries none */
    public String deviceUsername = "admin";
    public String devicePassword = "password";
    /* Timeout of each device request, in milliseconds. */
    public int deviceRequestTimeout = 10000;
    /* Whether to print verbose running information */
    public boolean verbose = false;
    /* Whether to control an in-memory device instead of real cameras. */
    public boolean fakeDevice = false;
    /* Whether only the usage was requested. */
    public boolean helpRequested = false;
    @Nullable
    public String log4jPropFilePath = null;
    @Nullable
    public String configFilePath = null;

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "Print this help message.");
        options.addOption("v", "verbose", false, "Display debug information.");
        options.addOption("c", "config-file", true,
                "Path of the JSON configuration file."
                        + " If not specified, use ~/.monocle/config.json or ./config.json, if exists.");
        options.addOption("p", "port", true, "Port of the local control server.");
        options.addOption(null, "log4j-property-file", true, "Path of the log4j property file.");
        options.addOption(null, "fake-device", false, "Control an in-memory fake device instead of real cameras.");
        return options;
    }

    /**
     * @return the default locations of the configuration file, in lookup order.
     */
    public static List<File> defaultConfigFiles() {
        return Arrays.asList(
                new File(new File(System.getProperty("user.home"), ".monocle"), "config.json"),
                new File("config.json"));
    }

    public GatewayPropertyCenter(@Nonnull String... args) throws ParseException, IOException {
        this(defaultConfigFiles(), args);
    }

    /**
     * Parse the command line and load the configuration.
     *
     * @param defaultConfigFiles locations tried, in order, when no config file is given.
     * @param args               command line arguments.
     * @throws ParseException           on a malformed command line.
     * @throws FileNotFoundException    if no configuration file can be found.
     * @throws IOException              if the configuration file cannot be read.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    GatewayPropertyCenter(@Nonnull List<File> defaultConfigFiles,
                          @Nonnull String... args) throws ParseException, IOException {
        final Options options = buildOptions();
        final CommandLine commandLine = new DefaultParser().parse(options, args);

        if (commandLine.hasOption('h')) {
            helpRequested = true;
            return;
        }

        verbose = commandLine.hasOption('v');
        if (verbose) {
            logger.setLevel(Level.DEBUG);
        }
        if (commandLine.hasOption("log4j-property-file")) {
            log4jPropFilePath = commandLine.getOptionValue("log4j-property-file");
        }
        fakeDevice = commandLine.hasOption("fake-device");

        /* Load properties from file. */
        final File configFile;
        if (commandLine.hasOption('c')) {
            configFile = new File(commandLine.getOptionValue('c'));
            if (!configFile.isFile()) {
                throw new FileNotFoundException("Couldn't find configuration file at specified path: \""
                        + configFile.getPath() + "\"");
            }
        } else {
            configFile = defaultConfigFiles.stream()
                    .filter(File::isFile)
                    .findFirst()
                    .orElseThrow(() -> new FileNotFoundException(
                            "Couldn't find a configuration file; tried " + defaultConfigFiles));
        }
        configFilePath = configFile.getAbsolutePath();
        logger.debug("Loading configuration from " + configFilePath + "...");
        load(FileUtils.readFileToString(configFile, StandardCharsets.UTF_8));

        if (commandLine.hasOption('p')) {
            port = parseInt("port", commandLine.getOptionValue('p'));
        }

        validateConfigurations();
    }

    /**
     * Digest the settings of a JSON configuration.
     */
    private void load(String json) {
        final JsonObject config;
        try {
            final JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("Configuration file must hold a JSON object");
            }
            config = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed configuration file: " + e.getMessage(), e);
        }

        for (Entry<String, JsonElement> entry : config.entrySet()) {
            final JsonElement value = entry.getValue();
            if (value.isJsonNull()) {
                continue;
            }
            if (!value.isJsonPrimitive()) {
                throw new IllegalArgumentException("Configuration \"" + entry.getKey() + "\" must be a plain value");
            }
            final String text = value.getAsString();
            if (!"monocle-api-token".equals(entry.getKey()) && !"device-password".equals(entry.getKey())) {
                logger.debug("Read from configuration file: " + entry.getKey() + "=" + text);
            }
            switch (entry.getKey()) {
                case "monocle-api-token":
                    apiToken = text;
                    break;
                case "monocle-api-uri":
                    apiUri = text;
                    break;
                case "port":
                    port = parseInt(entry.getKey(), text);
                    break;
                case "reconnectInterval":
                    reconnectInterval = parseInt(entry.getKey(), text);
                    break;
                case "device-username":
                    deviceUsername = text;
                    break;
                case "device-password":
                    devicePassword = text;
                    break;
                case "device-request-timeout":
                    deviceRequestTimeout = parseInt(entry.getKey(), text);
                    break;
                case "verbose":
                    verbose = verbose || Boolean.parseBoolean(text);
                    break;
                default:
                    logger.debug("Ignoring unknown configuration \"" + entry.getKey() + "\"");
            }
        }
    }

    private static int parseInt(String key, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration \"" + key + "\" must be an integer: " + text, e);
        }
    }

    private void validateConfigurations() {
        if (StringUtils.isBlank(apiToken)) {
            throw new IllegalArgumentException("Missing required configuration \"monocle-api-token\"");
        }
        if (StringUtils.isBlank(apiUri)) {
            throw new IllegalArgumentException("Configuration \"monocle-api-uri\" must not be empty");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Configuration \"port\" out of range: " + port);
        }
        if (reconnectInterval <= 0) {
            throw new IllegalArgumentException("Configuration \"reconnectInterval\" must be positive");
        }
        if (deviceRequestTimeout <= 0) {
            throw new IllegalArgumentException("Configuration \"device-request-timeout\" must be positive");
        }
    }

    /**
     * @return the usage of the command line.
     */
    public static String getHelp() {
        final StringWriter writer = new StringWriter();
        new HelpFormatter().printHelp(new PrintWriter(writer), HelpFormatter.DEFAULT_WIDTH,
                "monocle-gateway", null, buildOptions(),
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        return writer.toString();
    }
}
