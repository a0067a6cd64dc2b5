package au.org.ala.renditions.cache;

import au.org.ala.renditions.TestBase;
import au.org.ala.renditions.pipeline.PipelineBuilder;
import au.org.ala.renditions.render.DefaultRenditionRenderer;
import au.org.ala.renditions.render.RenderScheduler;
import au.org.ala.renditions.sizing.SizePlanner;
import au.org.ala.renditions.spec.ScaleFilter;
import au.org.ala.renditions.store.RenditionStore;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class CacheJanitorTest extends TestBase {

    private Path root;
    private CacheJanitor janitor;

    @Before
    public void setUp() throws IOException {
        root = temp.newFolder("static", "_img").toPath();
        janitor = new CacheJanitor(root);
    }

    private Path file(String relative, long ageSeconds) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[] { 1 });
        setAge(file, ageSeconds);
        return file;
    }

    @Test
    public void testExpiresOldRenditions() throws IOException {
        Path stale = file("ab/cdef/stale_1234567890_100x50.jpg", 2 * 3600);
        Path fresh = file("ab/cdef/fresh_1234567890_100x50.jpg", 30 * 60);
        Path lonely = file("12/3456/lonely_1234567890.png", 2 * 3600);

        SweepResult result = janitor.sweep(Duration.ofSeconds(3600));

        assertFalse(Files.exists(stale));
        assertTrue(Files.exists(fresh));
        assertFalse(Files.exists(lonely));
        // both levels of the emptied shard are gone, the other shard stays
        assertFalse(Files.exists(root.resolve("12/3456")));
        assertFalse(Files.exists(root.resolve("12")));
        assertTrue(Files.isDirectory(root.resolve("ab/cdef")));
        assertTrue(Files.isDirectory(root));

        assertEquals(2, result.getFilesDeleted());
        assertEquals(1, result.getFilesRetained());
        assertEquals(2, result.getDirectoriesRemoved());
        assertEquals(0, result.getErrors());
    }

    @Test
    public void testRootIsKeptWhenEmpty() throws IOException {
        file("ab/cdef/old.jpg", 10000);
        janitor.sweep(Duration.ofSeconds(60));
        assertTrue(Files.isDirectory(root));
        try (var entries = Files.list(root)) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    public void testMissingRoot() {
        SweepResult result = new CacheJanitor(root.resolve("nope")).sweep(Duration.ofSeconds(1));
        assertEquals(0, result.getFilesDeleted());
    }

    @Test
    public void testScheduledOnRenderPool() throws Exception {
        Path stale = file("ab/cdef/stale.jpg", 7200);
        RenditionStore store = new RenditionStore(root.getParent(), "_img",
                new PipelineBuilder(SizePlanner.INSTANCE, ScaleFilter.LANCZOS));
        RenderScheduler scheduler = new RenderScheduler(store, new DefaultRenditionRenderer(), 1);
        try {
            janitor.schedule(scheduler, Duration.ofHours(1)).get(10, TimeUnit.SECONDS);
            assertFalse(Files.exists(stale));
        } finally {
            scheduler.shutdown(10, TimeUnit.SECONDS);
        }
    }
}
