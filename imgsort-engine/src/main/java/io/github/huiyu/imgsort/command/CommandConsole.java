package io.github.huiyu.imgsort.command;

import io.github.huiyu.imgsort.cache.CacheEntry;
import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.image.ImageMetadata;
import io.github.huiyu.imgsort.mutation.FileMutationEngine;
import io.github.huiyu.imgsort.mutation.UndoRecord;
import io.github.huiyu.imgsort.navigation.NavigationOrchestrator;
import io.github.huiyu.imgsort.scan.ImageScanner;
import io.github.huiyu.imgsort.schedule.Result;
import io.github.huiyu.imgsort.slideshow.SlideshowTimer;
import io.github.huiyu.imgsort.watch.ImageDirectoryWatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Headless front end: scans, shows the first image and then reads one input symbol per
 * line from stdin. Shown images are printed, not rendered.
 */
@Component
@ConditionalOnProperty(prefix = "imgsort", name = "console.enabled", havingValue = "true", matchIfMissing = true)
public class CommandConsole implements CommandLineRunner {

    private static final Logger LOG = LoggerFactory.getLogger(CommandConsole.class);

    private final ImageScanner scanner;
    private final NavigationOrchestrator orchestrator;
    private final FileMutationEngine mutationEngine;
    private final SlideshowTimer slideshow;
    private final KeyBindings keyBindings;
    private final ObjectProvider<ImageDirectoryWatcher> watcher;

    PrintStream out = System.out;

    @Autowired
    public CommandConsole(ImageScanner scanner,
                          NavigationOrchestrator orchestrator,
                          FileMutationEngine mutationEngine,
                          SlideshowTimer slideshow,
                          KeyBindings keyBindings,
                          ObjectProvider<ImageDirectoryWatcher> watcher) {
        this.scanner = scanner;
        this.orchestrator = orchestrator;
        this.mutationEngine = mutationEngine;
        this.slideshow = slideshow;
        this.keyBindings = keyBindings;
        this.watcher = watcher;
    }

    @Override
    public void run(String... args) throws Exception {
        orchestrator.open(scanner.scan());
        watcher.ifAvailable(ImageDirectoryWatcher::start);
        slideshow.setListener(this::print);
        show(orchestrator.show());

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        read(in);
        LOG.info("Bye");
    }

    void read(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.trim().isEmpty()) {
                continue;
            }
            Command command = keyBindings.resolve(line);
            if (command == null) {
                out.println("Unbound key '" + line.trim() + "'");
                continue;
            }
            if (!dispatch(command)) {
                return;
            }
        }
    }

    /**
     * @return false when the console should stop
     */
    boolean dispatch(Command command) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Command {}", command);
        }
        switch (command.getType()) {
            case NEXT:
            case PREVIOUS:
            case RANDOM:
                slideshow.press(command.getType().getDirection());
                show(orchestrator.navigate(command.getType().getDirection()));
                break;
            case FIRST:
            case LAST:
                show(orchestrator.navigate(command.getType().getDirection()));
                break;
            case DELETE:
                afterMutation(mutationEngine.deleteCurrent());
                break;
            case MOVE:
                afterMutation(mutationEngine.moveCurrent(command.getCategory()));
                break;
            case UNDO:
                afterMutation(mutationEngine.undo());
                break;
            case SLIDESHOW:
                out.println("Slideshow " + slideshow.toggle());
                break;
            case QUIT:
                return false;
            default:
                throw new IllegalStateException("Unhandled command " + command);
        }
        return true;
    }

    private void afterMutation(CompletableFuture<Result<UndoRecord>> mutation) {
        mutation.thenAccept(r -> {
            if (r.isOk() && r.getKind() == ErrorKind.EMPTY_UNDO) {
                out.println("Nothing to undo");
            } else if (r.isOk()) {
                out.println("Done: " + r.getValue());
                show(orchestrator.show());
            } else if (r.isFailed()) {
                out.println("Failed: " + r.getKind() + " " + r.getMessage());
            }
        });
    }

    private void show(CompletableFuture<Result<CacheEntry>> pending) {
        pending.thenAccept(this::print);
    }

    private void print(Result<CacheEntry> result) {
        if (result.isCancelled()) {
            return;
        }
        if (result.isFailed()) {
            out.println("! " + result.getKind() + " " + result.getMessage());
            return;
        }
        CacheEntry entry = result.getValue();
        ImageMetadata metadata = entry.getMetadata();
        StringBuilder line = new StringBuilder(entry.getIdentity().toString());
        if (metadata != null) {
            line.append(' ').append(metadata.getWidth()).append('x').append(metadata.getHeight());
        }
        if (result.getKind() == ErrorKind.CAPACITY) {
            line.append(" (not cached)");
        }
        out.println(line);
    }
}
