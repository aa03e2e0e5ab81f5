package io.ontregistry.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ontregistry.model.ExperimentEntry;
import io.ontregistry.storage.RegistryIoException;
import io.ontregistry.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a discoverer's output batch. Accepts JSON or YAML, either a bare list of entries or an
 * object holding them under {@code experiments}.
 */
public final class DiscoveryReader {
    private DiscoveryReader() {
    }

    public static List<ExperimentEntry> read(Path file) {
        ObjectMapper mapper = Jsons.mapperFor(file);
        try {
            JsonNode root = mapper.readTree(file.toFile());
            JsonNode list = root != null && root.isObject() ? root.path("experiments") : root;
            if (list == null || !list.isArray()) {
                throw new IllegalArgumentException("Discovery file " + file + " holds no list of experiments");
            }
            List<ExperimentEntry> out = new ArrayList<>(list.size());
            for (JsonNode node : list) {
                out.add(mapper.treeToValue(node, ExperimentEntry.class));
            }
            return out;
        } catch (IOException e) {
            throw new RegistryIoException("Failed to read discovery file: " + file, e);
        }
    }
}
