package com.plotbinding.core.resources;

import com.plotbinding.core.model.AssetComponent;
import com.plotbinding.core.model.AssetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks that the packaged BokehJS build contains every asset the resolver can ask for.
 *
 * <p>For each component and each kind it ships, both {@code <name>.<ext>} and
 * {@code <name>.min.<ext>} must exist under {@code <root>/js} or {@code <root>/css}.
 */
public class AssetLayoutValidator {

    private static final Logger log = LoggerFactory.getLogger(AssetLayoutValidator.class);

    private final ClassLoader classLoader;

    public AssetLayoutValidator(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    /**
     * Lists the resource paths a complete build provides.
     *
     * @param root resource root, empty for the class path root
     * @return expected resource paths in component order
     */
    public static List<String> expectedResources(String root) {
        String prefix = ResourceResolver.normalizeRoot(root);
        List<String> paths = new ArrayList<>();
        for (AssetComponent component : AssetComponent.values()) {
            for (AssetKind kind : component.kinds()) {
                String dir = prefix + kind.lookupRoot() + "/";
                paths.add(dir + component.assetName() + "." + kind.extension());
                paths.add(dir + component.assetName() + ".min." + kind.extension());
            }
        }
        return paths;
    }

    /**
     * Checks the layout under a resource root.
     *
     * @param root resource root, empty for the class path root
     * @return report listing the missing resources
     */
    public LayoutReport validate(String root) {
        List<String> expected = expectedResources(root);
        List<String> missing = new ArrayList<>();

        for (String path : expected) {
            if (classLoader.getResource(path) == null) {
                log.debug("Missing asset: {}", path);
                missing.add(path);
            }
        }

        if (missing.isEmpty()) {
            log.info("Asset layout complete: {} resources found", expected.size());
        } else {
            log.warn("Asset layout incomplete: {} of {} resources missing", missing.size(), expected.size());
        }
        return new LayoutReport(root == null ? "" : root, expected, missing);
    }
}
