package io.kneo.programmer.service.compiler;

import io.kneo.programmer.service.exceptions.CompileError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class BlockCompilerRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(BlockCompilerRegistry.class);
    private final Map<BlockKind, BlockCompiler> compilers = new EnumMap<>(BlockKind.class);

    public BlockCompilerRegistry(List<BlockCompiler> available) {
        available.forEach(this::register);
        LOGGER.debug("Registered {} block compilers", compilers.size());
    }

    public static BlockCompilerRegistry defaults() {
        return new BlockCompilerRegistry(List.of(
                new EpisodeBlockCompiler(),
                new MovieBlockCompiler(),
                new MovieMarathonCompiler(),
                new PoolBlockCompiler()));
    }

    private void register(BlockCompiler compiler) {
        for (BlockKind kind : BlockKind.values()) {
            if (compiler.supports(kind)) {
                compilers.put(kind, compiler);
                LOGGER.debug("Registered compiler {} for block kind {}", compiler.getClass().getSimpleName(), kind);
            }
        }
    }

    public BlockCompiler getCompiler(BlockKind kind) {
        BlockCompiler compiler = compilers.get(kind);
        if (compiler == null) {
            throw new CompileError("No compiler registered for block kind " + kind);
        }
        return compiler;
    }
}
