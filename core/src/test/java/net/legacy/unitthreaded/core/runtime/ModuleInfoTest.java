package net.legacy.unitthreaded.core.runtime;

import example.tests.inline.InlineBlocks;
import example.tests.pass.NormalModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModuleInfoTest {

    @BeforeEach
    void setUp() {
        InlineBlocks.CALLS.clear();
    }

    @Test
    void blocksRunInMethodNameOrder() throws Exception {
        ModuleInfo module = ModuleInfo.fromClass(InlineBlocks.class).orElseThrow();

        module.getUnitTest().invoke();

        assertEquals("example.tests.inline.InlineBlocks", module.getName());
        assertEquals(List.of("firstBlock", "secondBlock"), InlineBlocks.CALLS);
    }

    @Test
    void classWithoutBlocksHasNoModuleInfo() {
        assertEquals(Optional.empty(), ModuleInfo.fromClass(String.class));
    }

    @Test
    void explicitSourceSkipsClassesWithoutBlocks() {
        List<ModuleInfo> modules = ModuleInfoSource.of(String.class, InlineBlocks.class, NormalModule.class).getModules();

        assertEquals(2, modules.size());
        assertEquals("example.tests.inline.InlineBlocks", modules.get(0).getName());
        assertEquals("example.tests.pass.NormalModule", modules.get(1).getName());
    }

}
