package au.org.ala.renditions.delivery;

import au.org.ala.renditions.RenditionConfig;
import au.org.ala.renditions.TestBase;
import au.org.ala.renditions.pipeline.PipelineBuilder;
import au.org.ala.renditions.render.RenderScheduler;
import au.org.ala.renditions.sizing.SizePlanner;
import au.org.ala.renditions.source.ImageProbe;
import au.org.ala.renditions.source.SourceImage;
import au.org.ala.renditions.source.SourceImageRegistry;
import au.org.ala.renditions.spec.CropRect;
import au.org.ala.renditions.spec.RenditionSpec;
import au.org.ala.renditions.store.RenditionStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class AsyncRenditionHandlerTest extends TestBase {

    private final CountDownLatch release = new CountDownLatch(1);
    private final RenditionSpec spec = RenditionSpec.builder().width(100).build();

    private RenditionConfig config;
    private RenditionStore store;
    private RenderScheduler scheduler;
    private PendingTokenCodec codec;
    private AsyncRenditionHandler handler;
    private SourceImage source;

    @Before
    public void setUp() throws IOException {
        config = new RenditionConfig();
        config.setStaticFolder(temp.newFolder("static").toPath());
        config.setTokenSecret("s3cret");
        config.setAsyncRetryDelayMillis(0);

        SourceImageRegistry registry = new SourceImageRegistry(new ImageProbe(config.getRenditionVersion()));
        store = new RenditionStore(config.getStaticFolder(), config.getOutputSubdir(),
                new PipelineBuilder(SizePlanner.INSTANCE, config.getDefaultScaleFilter()));
        // renders stay pending until released
        scheduler = new RenderScheduler(store, (s, p, out) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, 1);
        codec = new PendingTokenCodec(config.getTokenSecret());
        handler = new AsyncRenditionHandler(config, registry, scheduler, codec);
        source = registry.get(writeJpeg("photo.jpg", 400, 200));
    }

    @After
    public void tearDown() {
        release.countDown();
        scheduler.shutdown(10, TimeUnit.SECONDS);
    }

    private String token() {
        return codec.encode(new PendingToken(source.getPath(), 1, spec));
    }

    @Test
    public void testStaticFileRedirects() throws IOException {
        Files.write(config.getStaticFolder().resolve("robots.txt"), new byte[] { 1 });
        AsyncResponse response = handler.handle("robots.txt", 0);
        assertEquals(AsyncResponse.FOUND, response.getStatus());
        assertEquals("/static/robots.txt", response.getHeader("Location").get());
    }

    @Test
    public void testTraversalIsNotServedAsStatic() throws IOException {
        Files.write(temp.getRoot().toPath().resolve("secret.txt"), new byte[] { 1 });
        AsyncResponse response = handler.handle("../secret.txt", 0);
        assertEquals(AsyncResponse.BAD_REQUEST, response.getStatus());
    }

    @Test
    public void testBadToken() {
        assertEquals(AsyncResponse.BAD_REQUEST, handler.handle("not-a-token", 0).getStatus());
    }

    @Test
    public void testMissingSource() {
        String token = codec.encode(new PendingToken(temp.getRoot().toPath().resolve("gone.jpg"), 1, spec));
        assertEquals(AsyncResponse.NOT_FOUND, handler.handle(token, 0).getStatus());
    }

    @Test
    public void testCropOutsideSource() {
        RenditionSpec cropped = RenditionSpec.builder().crop(CropRect.parse("500,0,100,100")).build();
        String token = codec.encode(new PendingToken(source.getPath(), 1, cropped));
        AsyncResponse response = handler.handle(token, 0);
        assertEquals(AsyncResponse.BAD_REQUEST, response.getStatus());
        assertFalse(response.isRedirect());
    }

    @Test
    public void testReadyRenditionRedirectsToCache() throws IOException {
        RenditionStore.Resolution resolution = store.resolve(source, spec, 1);
        store.prepare(resolution);
        Files.write(resolution.getPath(), new byte[] { 1 });

        AsyncResponse response = handler.handle(token(), 3);
        assertTrue(response.isRedirect());
        assertEquals("/static/" + resolution.getRelativePath(), response.getHeader("Location").get());
    }

    @Test
    public void testPendingRedirectsToItselfWithIncrementedCounter() {
        String token = token();
        AsyncResponse response = handler.handle(token, 0);
        assertTrue(response.isRedirect());
        String location = response.getHeader("Location").get();
        assertTrue(location, location.startsWith("/_async/" + token + "?retry_count=1&cb="));

        response = handler.handle(token, 9);
        assertTrue(response.isRedirect());
        assertTrue(response.getHeader("Location").get().contains("retry_count=10&"));

        // the first poll queued the render; polling does not queue more
        assertTrue(scheduler.isOutstanding(store.resolve(source, spec, 1).getPath()));
    }

    @Test
    public void testPlaceholderAfterRetryLimit() throws IOException {
        String token = token();
        AsyncResponse response = handler.handle(token, 10);
        assertEquals(AsyncResponse.OK, response.getStatus());
        assertFalse(response.isRedirect());
        assertEquals("image/png", response.getContentType());
        assertEquals("5", response.getHeader(AsyncRenditionHandler.REFRESH_HEADER).get());

        BufferedImage placeholder = ImageIO.read(new ByteArrayInputStream(response.getBody()));
        assertEquals(2, placeholder.getWidth());
        assertEquals(2, placeholder.getHeight());

        // same target, same placeholder
        assertArrayEquals(response.getBody(), handler.handle(token, 12).getBody());
    }
}
