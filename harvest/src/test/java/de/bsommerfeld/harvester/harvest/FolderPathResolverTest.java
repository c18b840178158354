package de.bsommerfeld.harvester.harvest;

import de.bsommerfeld.harvester.core.config.HarvestConfig;
import de.bsommerfeld.harvester.core.domain.HarvestRequest;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.core.domain.ItemKind;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.FrameioApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FolderPathResolverTest {

    @Mock
    private FrameioApi api;

    private FolderPathResolver resolver;
    private HarvestContext ctx;

    @BeforeEach
    void setUp() {
        resolver = new FolderPathResolver(api);
        HarvestRequest request = new HarvestRequest("t", "p1", null, false, null);
        ctx = new HarvestContext("run", request, AssetFilter.of(request, new HarvestConfig()));
        ctx.setRootFolderId("root");
        ctx.registerContainer(new Item("root", "Project", ItemKind.FOLDER, null));
    }

    @Test
    void resolve_shouldMapRootToSlash() {
        assertEquals("/", resolver.resolve(ctx, "root"));
        assertEquals("/", resolver.resolve(ctx, null));
    }

    @Test
    void resolve_shouldJoinRegisteredAncestors() {
        ctx.registerContainer(new Item("A", "Edits", ItemKind.FOLDER, "root"));
        ctx.registerContainer(new Item("B", "Round 2", ItemKind.FOLDER, "A"));

        assertEquals("/Edits/Round 2", resolver.resolve(ctx, "B"));
        assertEquals("/Edits/Round 2", ctx.cachedPath("B"));
    }

    @Test
    void resolve_shouldLookUpUnknownAncestorsOnce() throws Exception {
        ctx.registerContainer(new Item("B", "Round 2", ItemKind.FOLDER, "A"));
        when(api.getItem("A")).thenReturn(new Item("A", "Edits", ItemKind.FOLDER, "root"));

        assertEquals("/Edits/Round 2", resolver.resolve(ctx, "B"));
        ctx.registerContainer(new Item("C", "Round 3", ItemKind.FOLDER, "A"));
        assertEquals("/Edits/Round 3", resolver.resolve(ctx, "C"));

        verify(api, times(1)).getItem("A");
    }

    @Test
    void resolve_shouldTreatUnresolvableAncestorAsRoot() throws Exception {
        ctx.registerContainer(new Item("B", "Round 2", ItemKind.FOLDER, "gone"));
        when(api.getItem("gone")).thenThrow(new FrameioApiException("missing", 404));

        assertEquals("/Round 2", resolver.resolve(ctx, "B"));
    }

    @Test
    void resolve_shouldStopAtCyclicParents() {
        ctx.registerContainer(new Item("X", "x", ItemKind.FOLDER, "Y"));
        ctx.registerContainer(new Item("Y", "y", ItemKind.FOLDER, "X"));

        assertEquals("/y/x", resolver.resolve(ctx, "X"));
    }

    @Test
    void resolve_shouldReuseCachedAncestorPath() {
        ctx.registerContainer(new Item("A", "Edits", ItemKind.FOLDER, "root"));
        ctx.cachePath("A", "/Edits");
        ctx.registerContainer(new Item("B", "Round 2", ItemKind.FOLDER, "A"));

        assertEquals("/Edits/Round 2", resolver.resolve(ctx, "B"));
    }

    @Test
    void resolve_shouldCacheEveryAncestorOnTheChain() {
        ctx.registerContainer(new Item("A", "Edits", ItemKind.FOLDER, "root"));
        ctx.registerContainer(new Item("B", "Round 2", ItemKind.FOLDER, "A"));
        ctx.registerContainer(new Item("C", "Notes", ItemKind.FOLDER, "B"));

        assertEquals("/Edits/Round 2/Notes", resolver.resolve(ctx, "C"));

        assertEquals("/Edits", ctx.cachedPath("A"));
        assertEquals("/Edits/Round 2", ctx.cachedPath("B"));
    }

    @Test
    void resolve_shouldExtendCachedBaseForIntermediateAncestors() {
        ctx.cachePath("A", "/Edits");
        ctx.registerContainer(new Item("B", "Round 2", ItemKind.FOLDER, "A"));
        ctx.registerContainer(new Item("C", "Notes", ItemKind.FOLDER, "B"));

        assertEquals("/Edits/Round 2/Notes", resolver.resolve(ctx, "C"));
        assertEquals("/Edits/Round 2", ctx.cachedPath("B"));
    }
}
