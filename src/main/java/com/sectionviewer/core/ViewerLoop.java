package com.sectionviewer.core;

import com.sectionviewer.clip.ClippingEngine;
import com.sectionviewer.control.CommandQueue;
import com.sectionviewer.control.CommandRouter;
import com.sectionviewer.control.ControlServer;
import com.sectionviewer.control.Messages;
import com.sectionviewer.mesh.MeshSource;
import com.sectionviewer.mesh.Primitives;
import com.sectionviewer.render.HeadlessRenderer;
import com.sectionviewer.render.VirtualGizmo;

import java.util.logging.Logger;

/**
 * Update loop tying the clipping engine to the control channel.
 * <p>
 * Fixed-rate ticks: drain UI commands, apply them to the engine, then push
 * state to connected clients if anything changed. The engine is only touched
 * from this thread.
 */
public class ViewerLoop {

    private static final Logger LOG = Logger.getLogger(ViewerLoop.class.getName());

    private final ViewerConfig config;
    private long maxTicks = -1;
    private volatile boolean running;

    private HeadlessRenderer renderer;
    private VirtualGizmo gizmo;
    private ClippingEngine engine;
    private CommandQueue commandQueue;
    private ControlServer controlServer;

    private long tickCount;
    private boolean stateDirty;

    public ViewerLoop(ViewerConfig config) {
        this.config = config;
    }

    /** Stop after this many ticks; negative runs until {@link #requestStop()}. */
    public void setMaxTicks(long maxTicks) { this.maxTicks = maxTicks; }

    public void requestStop() { running = false; }

    public void run() {
        init();
        try {
            loop();
        } finally {
            cleanup();
        }
    }

    void init() {
        renderer = new HeadlessRenderer();
        gizmo = new VirtualGizmo();
        engine = new ClippingEngine(renderer, gizmo, config.getFillStyle());
        engine.addListener(event -> {
            if (controlServer != null) {
                controlServer.broadcastEvent(Messages.buildEvent(event));
            }
            stateDirty = true;
        });

        String modelName = config.getModel();
        MeshSource model = Primitives.named(modelName);
        if (model == null) {
            LOG.warning("[ViewerLoop] Unknown model '" + modelName + "', starting empty");
        }
        engine.setModel(model);
        engine.setClippingEnabled(config.isClippingEnabled());

        commandQueue = new CommandQueue();
        if (config.isControlEnabled()) {
            controlServer = new ControlServer(config.getControlPort(), commandQueue,
                                              config.getBroadcastIntervalMs());
            controlServer.start();
            LOG.info("[ViewerLoop] Control server starting on port " + config.getControlPort());
        }

        stateDirty = true;
        LOG.info("[ViewerLoop] Initialized (model=" + modelName + ", tickRate=" + config.getTickRateHz() + " Hz)");
    }

    private void loop() {
        running = true;
        long tickNanos = 1_000_000_000L / config.getTickRateHz();
        long next = System.nanoTime();

        while (running && (maxTicks < 0 || tickCount < maxTicks)) {
            tick();

            next += tickNanos;
            long sleepNanos = next - System.nanoTime();
            if (sleepNanos > 0) {
                try {
                    Thread.sleep(sleepNanos / 1_000_000L, (int) (sleepNanos % 1_000_000L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    running = false;
                }
            } else {
                // Fell behind; don't try to catch up
                next = System.nanoTime();
            }
        }
        LOG.info("[ViewerLoop] Stopped after " + tickCount + " ticks");
    }

    /** One update: apply queued commands, then publish state if needed. */
    void tick() {
        tickCount++;
        commandQueue.drain(command -> {
            if (CommandRouter.apply(command, engine, gizmo)) {
                stateDirty = true;
            }
        });

        if (stateDirty) {
            if (controlServer == null) {
                stateDirty = false;
            } else if (controlServer.broadcastState(Messages.buildState(engine.snapshot(),
                    axis -> engine.descriptor(axis).getCapMesh()))) {
                stateDirty = false;
            }
        }
    }

    private void cleanup() {
        if (controlServer != null) {
            controlServer.shutdown();
            controlServer = null;
        }
        LOG.info("[ViewerLoop] Shut down");
    }

    // --- Accessors ---

    public ClippingEngine getEngine() { return engine; }
    public HeadlessRenderer getRenderer() { return renderer; }
    public VirtualGizmo getGizmo() { return gizmo; }
    public CommandQueue getCommandQueue() { return commandQueue; }
    public long getTickCount() { return tickCount; }
    boolean isStateDirty() { return stateDirty; }
}
