package com.vela.script.repl;

import java.io.File;
import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.vela.script.VelaScript;
import com.vela.script.parser.Value;
import com.vela.script.plugins.VelaMathPlugin;

/**
 * Settings for the read loop and the engine it drives, read from the {@code vela}
 * block of a Typesafe {@link Config}.
 */
public final class ReplSettings {

    private static final Logger LOG = LoggerFactory.getLogger(ReplSettings.class);
    private static final String CONFIG_FILE_NAME = "vela.conf";

    public final int maxCallDepth;
    public final int maxNestingDepth;
    public final String prompt;
    public final boolean echoAst;
    public final boolean realClock;
    public final boolean mathPlugin;

    private ReplSettings(Config vela) {
        this.maxCallDepth = vela.getInt("interpreter.max-call-depth");
        this.maxNestingDepth = vela.getInt("interpreter.max-nesting-depth");
        this.prompt = vela.getString("repl.prompt");
        this.echoAst = vela.getBoolean("repl.echo-ast");
        this.realClock = vela.getBoolean("repl.real-clock");
        this.mathPlugin = vela.getBoolean("repl.plugins.math");
    }

    /**
     * Loads settings, first source wins:
     * 1. System properties (-Dvela.repl.prompt=...)
     * 2. vela.conf in the working directory
     * 3. reference.conf on the classpath
     */
    public static ReplSettings load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.empty();
        }

        final Config combined = ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"));
        return from(combined.resolve());
    }

    /** Settings from {@code config}, falling back to reference.conf for missing keys. */
    public static ReplSettings from(Config config) {
        Config merged = config.withFallback(ConfigFactory.parseResources("reference.conf")).resolve();
        return new ReplSettings(merged.getConfig("vela"));
    }

    /** Engine configured with these settings; {@code print} writes to {@code out}. */
    public VelaScript createEngine(PrintStream out) {
        VelaScript engine = new VelaScript(out);
        engine.setMaxCallDepth(maxCallDepth);
        engine.setMaxNestingDepth(maxNestingDepth);
        if (realClock) {
            engine.registerFunction("time", (args, env) -> Value.number(System.currentTimeMillis()));
        }
        if (mathPlugin) {
            VelaMathPlugin.register(engine);
        }
        return engine;
    }

    @Override
    public String toString() {
        return "maxCallDepth=" + maxCallDepth
                + " maxNestingDepth=" + maxNestingDepth
                + " echoAst=" + echoAst
                + " realClock=" + realClock
                + " mathPlugin=" + mathPlugin;
    }
}
