package org.tapline.compiler.plugins;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.tapline.compiler.BufferSource;
import org.tapline.compiler.Compilation;
import org.tapline.compiler.Compiler;
import org.tapline.compiler.Module;
import org.tapline.compiler.Plugin;
import org.tapline.compiler.Source;

/**
 * Emits the content of every file-backed entry module as an asset named after the
 * {@code output.filename} template, with {@code [name]} replaced by the entry name.
 * <p>
 * The source of an asset whose content did not change since the previous build is reused,
 * so emission recognizes it as already written.
 */
public class EntryAssetPlugin implements Plugin {

    private final Map<String, BufferSource> previous = new ConcurrentHashMap<>();

    @Override
    public void apply(Compiler compiler) {
        String template = compiler.getOptions().output().filename();
        compiler.hooks.thisCompilation.tap("EntryAssetPlugin", compilation ->
                compilation.hooks.additionalAssets.tap("EntryAssetPlugin", sealed -> emitEntries(sealed, template)));
    }

    private void emitEntries(Compilation compilation, String template) {
        for (Map.Entry<String, Module> entry : compilation.getEntrypoints().entrySet()) {
            if (entry.getValue() instanceof FileModule file) {
                String assetName = template.replace("[name]", entry.getKey());
                compilation.emitAsset(assetName, sourceFor(assetName, file.content()));
            }
        }
    }

    private Source sourceFor(String assetName, byte[] content) {
        return previous.compute(assetName, (name, cached) ->
                cached != null && Arrays.equals(cached.buffer(), content) ? cached : new BufferSource(content));
    }
}
