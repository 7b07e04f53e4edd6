package org.calista.lumen.ai;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.lumen.ai.core.AIComposer;
import org.calista.lumen.ai.core.AIKernel;
import org.calista.lumen.ai.think.ResponseEngine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Scanner;

/**
 * LumenApp — interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (config + conversation store)
 *  2) compose the response engine
 *  3) run loop: read, answer, log
 *  4) close kernel (closes the store)
 */
public final class LumenApp {

    private static final Logger log = LogManager.getLogger(LumenApp.class);

    private final Path configRoot;
    private final Path cfgPath;

    public static void main(String[] args) throws Exception {
        Path cfg = args.length > 0 ? Path.of(args[0]) : Path.of("config/config.json");
        new LumenApp(Path.of("."), cfg).run(System.in, System.out);
    }

    public LumenApp(Path configRoot, Path cfgPath) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
    }

    public void run(InputStream in, PrintStream out) throws IOException {
        try (AIKernel kernel = AIKernel.builder().configRoot(configRoot).build(cfgPath)) {
            ResponseEngine engine = AIComposer.buildEngine(kernel);
            TurnProcessor turns = new TurnProcessor(engine, kernel.store());

            log.info("Lumen started. history.size={}", kernel.store().size());
            out.println("Type 'exit' to quit.");

            try (Scanner sc = new Scanner(in)) {
                while (true) {
                    out.print("> ");
                    out.flush();
                    if (!sc.hasNextLine()) break;

                    String user = sc.nextLine().trim();
                    if (user.equalsIgnoreCase("exit")) break;

                    out.println();
                    out.println(turns.process(user));
                    out.println();
                }
            }
            out.println("Bye.");
        }
    }
}
