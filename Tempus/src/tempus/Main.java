/*
 * Copyright (C) 2024 The Tempus Project
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package tempus;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.rmi.registry.LocateRegistry;
import java.rmi.registry.Registry;
import java.rmi.server.UnicastRemoteObject;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * The Tempus server.
 * 
 * This opens (or creates) the subscription ledger under the data 
 *   directory, initializes it on first run from the command line, and 
 *   then serves it over RMI until shut down.
 */
public class Main {
    
    // Ledger limits -----------------------------------------------------
    
    // 100%, in basis points
    public static final int MAX_BPS = 10000;
    
    // Protocol + client fees may not take more than 12.5% of a purchase
    public static final int MAX_FEE_BPS = 1250;
    
    // Tier ids are 1..MAX_TIERS
    public static final int MAX_TIERS = 65535;
    
    // Reward curve ids are 0..MAX_CURVES-1
    public static final int MAX_CURVES = 256;
    
    // A curve decays for at most this many periods
    public static final int MAX_CURVE_PERIODS = 255;
    
    // Default economic parameters ---------------------------------------
    
    // One unit of the currency in base units, for display only
    public static final long COIN = 100000000;
    
    public static final long DEFAULT_PERIOD_SECONDS = 30 * Timestamp.DAY;
    
    public static final long DEFAULT_PRICE_PER_PERIOD = COIN;
    
    // A lapsed subscriber keeps its reward shares this long
    public static final long DEFAULT_SLASH_GRACE_SECONDS = 7 * Timestamp.DAY;
    
    // Server configuration ----------------------------------------------

    // RMI server ports and names
    public static int RMI_REGISTRY_PORT = 1099;
    public static int RMI_SERVER_PORT = 11099;
    public static String RMI_SERVER_NAME = "TEMPUS";
    
    // Minutes between automatic snapshots while serving
    public static int SNAPSHOT_INTERVAL_MINUTES = 60;
    
    // Global vars -------------------------------------------------------
    
    // singleton static server supported
    static Server server;
    static Registry registry;
    
    static volatile boolean shutdown = false;
    static Thread mainThread;
    
    // Usable before main() sets up the log files (tests, embedding).
    public static Logger log = Logger.getGlobal();
    
    // Methods -----------------------------------------------------------
    
    public static void log(String message) {
        log.log(Level.INFO, message);
    }

    public static void logError(String message) {
        log.log(Level.SEVERE, message);
    }

    public static void logError(String message, Throwable ex) {
        log.log(Level.SEVERE, message, ex);
    }

    public static String formatMoney(long amount) {
        BigDecimal b = BigDecimal.valueOf(amount).divide(BigDecimal.valueOf(COIN));
        if (b.signum() < 0)
            return "(" + b.abs().toPlainString() + ")";
        else
            return b.toPlainString();
    }

    public static void createServer(String dataDir) throws Exception {
        if (server != null)
            throw new IllegalStateException("Only one Server at a time is supported by Main::createServer().");
        server = new Server(dataDir);
    }
    
    public static void startServer() throws Exception {
        if (server == null)
            throw new IllegalStateException("Cannot start server; server == null.");
        ServerInterface stub = (ServerInterface)
            UnicastRemoteObject.exportObject(server, RMI_SERVER_PORT);
        if (registry == null)
            registry = LocateRegistry.createRegistry(RMI_REGISTRY_PORT);
        registry.rebind(RMI_SERVER_NAME, stub);
    }
    
    public static void stopServer() throws Exception {
        if (registry != null) {
            registry.unbind(RMI_SERVER_NAME);
            registry = null;
        }
        if (server != null)
            UnicastRemoteObject.unexportObject(server, true);
    }

    public static synchronized void requestServerShutdown() {
        shutdown = true;
        if (mainThread != null)
            mainThread.interrupt();
    }

    static void deleteDirectory(Path directory) throws IOException {
        if (! Files.exists(directory))
            return;
        Files.walk(directory)
            .map(Path::toFile)
            .sorted((o1, o2) -> -o1.compareTo(o2))
            .forEach(File::delete);
    }
    
    // =========================================================================

    /**
     * This creates and starts a Tempus server.
     * @param argsArray the command-line arguments
     */
    public static void main(String[] argsArray)  {

        // ==================== Setup logging ===============================
        
        Path tempusDirPath = Paths.get(System.getProperty("user.home"), ".tempus");
        tempusDirPath.toFile().mkdirs();
        
        // %2$s = where
        System.setProperty("java.util.logging.SimpleFormatter.format", "%1$tF %1$tT [%4$s] %5$s%6$s%n");
        SimpleFormatter formatter = new SimpleFormatter();
        log = Logger.getGlobal();
        try {
            FileHandler fileHandler = new FileHandler("%h/.tempus/tempus%g.log", 10000000, 2, true);
            fileHandler.setFormatter(formatter);
            log.addHandler(fileHandler);
        } catch (IOException e) {
            logError("FATAL: Cannot open log files at " + tempusDirPath.toString(), e);
            System.exit(1);
        }
        
        // ============== Run everything wrapped around a try ===============

        try {
            main2(argsArray);
        } catch (Exception e) {
            logError("FATAL: Exception thrown in the main thread. Aborting process.", e);
            System.exit(1);
        }
    }
    
    // Reads the value of an option, or exits.
    static String next(Iterator<String> it, String option) {
        if (it.hasNext())
            return it.next();
        logError("Missing argument for --" + option + ".");
        System.exit(1);
        return null;
    }

    public static void main2(String[] argsArray) throws Exception {
        
        mainThread = Thread.currentThread();

        // ==================== Run args ====================================
        
        Path dataDirPath = Paths.get(System.getProperty("user.home"), ".tempus", "data");
        boolean resetData = false;
        boolean snapshot = false;
        boolean quit = false;
        InitParams init = new InitParams();
        
        List<String> args = Arrays.asList(argsArray);
        
        Iterator<String> it = args.iterator();
        while (it.hasNext()) {
            String arg = it.next();
            if (! arg.startsWith("--")) {
                logError("Unknown argument: " + arg);
                System.exit(1);
            }
            String cmd = arg.substring(2);
            switch (cmd) {
                case "data_dir":
                    dataDirPath = Paths.get(next(it, cmd));
                    break;
                case "reset_data":
                    resetData = true;
                    break;
                case "owner":
                    init.owner = Long.parseLong(next(it, cmd));
                    break;
                case "token":
                    init.currency = new TokenCurrency(next(it, cmd));
                    break;
                case "period_seconds":
                    init.tier.periodDurationSeconds = Long.parseLong(next(it, cmd));
                    break;
                case "price":
                    init.tier.pricePerPeriod = Long.parseLong(next(it, cmd));
                    break;
                case "initial_mint_price":
                    init.tier.initialMintPrice = Long.parseLong(next(it, cmd));
                    break;
                case "protocol_recipient":
                    init.fees.protocolRecipient = Long.parseLong(next(it, cmd));
                    init.fees.protocolBps = Integer.parseInt(next(it, cmd));
                    break;
                case "client_recipient":
                    init.fees.clientRecipient = Long.parseLong(next(it, cmd));
                    init.fees.clientBps = Integer.parseInt(next(it, cmd));
                    break;
                case "client_referral_bps":
                    init.fees.clientReferralBps = Integer.parseInt(next(it, cmd));
                    break;
                case "supply_cap":
                    init.globalSupplyCap = Long.parseLong(next(it, cmd));
                    break;
                case "slash_grace":
                    init.rewards.slashGracePeriod = Long.parseLong(next(it, cmd));
                    break;
                case "no_slash":
                    init.rewards.slashable = false;
                    break;
                case "snapshot":
                    snapshot = true;
                    break;
                case "quit":
                    quit = true;
                    break;
                default:
                    logError("Unknown command: " + arg);
                    System.exit(1);
            }
        }
        
        // ==================== Create the server ===========================
        
        log("Starting server.");
        log("Data directory: " + dataDirPath);
        
        if (resetData) {
            deleteDirectory(dataDirPath);
            log("Previous data has been destroyed (--reset_data).");
        }
        
        // Continues whatever was on the data dir
        createServer(dataDirPath.toString());
        
        // ==================== Initialize a fresh ledger ===================
        
        LedgerStats stats = server.getStats();
        if (! stats.initialized) {
            if (init.owner == 0) {
                logError("The ledger is not initialized yet; --owner <id> is required on first run.");
                System.exit(1);
            }
            server.initialize(init);
            log("Ledger initialized. Owner: " + init.owner + ", currency: " + init.currency);
        } else if (init.owner != 0) {
            log("Ledger already initialized (owner " + stats.owner + "); initialization options ignored.");
        }
        
        // ==================== Command: take snapshot ======================
        
        if (snapshot)
            server.takeSnapshot();

        // ==================== Quit if we're not going to listen ===========
        
        if (quit) {
            log("Quitting due to --quit flag.");
            server.close();
            System.exit(0);
        }

        // ==================== Start listening to clients ==================
        
        log("Starting RMI Server...");
        startServer();
        log("RMI Server started.");
        log("Server API name: " + RMI_SERVER_NAME);
        log("Server API port: " + RMI_SERVER_PORT);
        log("RMI Registry port: " + RMI_REGISTRY_PORT);
        
        // ==================== Main server loop ============================

        // The main thread only snapshots now and then; RMI threads do the 
        //   work. Killing the process loses nothing (the journal has it), 
        //   but a clean shutdown leaves a fresh snapshot for a fast restart.
        long lastSnapshot = System.currentTimeMillis();
        while (! shutdown) {
            try {
                Thread.sleep(60 * 1000);
            } catch (InterruptedException e) {
                log("Main thread interrupted.");
            }
            if (! shutdown && System.currentTimeMillis() - lastSnapshot >= SNAPSHOT_INTERVAL_MINUTES * 60 * 1000L) {
                server.takeSnapshot();
                lastSnapshot = System.currentTimeMillis();
            }
        }
        
        log("Stopping server...");
        stopServer();
        
        log("Taking a snapshot...");
        server.takeSnapshot();
        server.close();

        log("All done. Quitting.");
    }
}
