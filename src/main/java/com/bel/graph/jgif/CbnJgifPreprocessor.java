package com.bel.graph.jgif;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Maps JGIF exported by the Causal Biological Network (CBN) database onto the standard
 * annotation vocabulary before import.
 *
 * <p>Experiment-context keys {@code tissue}, {@code disease}, {@code cell} and
 * {@code species_common_name} become the {@code Tissue}, {@code Disease}, {@code Cell} and
 * {@code Species} annotations; species common names are replaced by NCBI taxonomy ids.
 * Blank values are dropped and all other keys are lower-cased.</p>
 */
public final class CbnJgifPreprocessor {
    private static final Logger log = LoggerFactory.getLogger(CbnJgifPreprocessor.class);

    public static final String AUTHORS = "Causal Biological Networks Database";

    public static final String LICENSES = String.join("\t",
            "Please cite:",
            "- www.causalbionet.com",
            "- https://bionet.sbvimprover.com",
            "as well as any relevant publications.",
            "The sbv IMPROVER project, the website and the Symposia are part of a collaborative project"
                    + " designed to enable scientists to learn about and contribute to the development of a new crowd"
                    + " sourcing method for verification of scientific data and results. The current challenges, website"
                    + " and biological network models were developed and are maintained as part of a collaboration among"
                    + " Selventa, OrangeBus and ADS. The project is led and funded by Philip Morris International. For more"
                    + " information on the focus of Philip Morris International's research, please visit www.pmi.com.");

    public static final Map<String, String> NAMESPACE_URLS = Map.of(
            "HGNC", "https://arty.scai.fraunhofer.de/artifactory/bel/namespace/hgnc-human-genes/hgnc-human-genes-20150601.belns",
            "GOBP", "https://arty.scai.fraunhofer.de/artifactory/bel/namespace/go-biological-process/go-biological-process-20150601.belns",
            "SFAM", "https://arty.scai.fraunhofer.de/artifactory/bel/namespace/selventa-protein-families/selventa-protein-families-20150601.belns");

    public static final Map<String, String> ANNOTATION_URLS = Map.of(
            "Cell", "https://arty.scai.fraunhofer.de/artifactory/bel/annotation/cell-line/cell-line-20150601.belanno",
            "Disease", "https://arty.scai.fraunhofer.de/artifactory/bel/annotation/disease/disease-20150601.belanno",
            "Species", "https://arty.scai.fraunhofer.de/artifactory/bel/annotation/species-taxonomy-id/species-taxonomy-id-20170511.belanno",
            "Tissue", "https://arty.scai.fraunhofer.de/artifactory/bel/annotation/mesh-anatomy/mesh-anatomy-20150601.belanno");

    static final Map<String, String> ANNOTATION_KEYS = Map.of(
            "tissue", "Tissue",
            "disease", "Disease",
            "species_common_name", "Species",
            "cell", "Cell");

    static final Map<String, String> SPECIES = Map.of(
            "human", "9606",
            "rat", "10116",
            "mouse", "10090");

    private CbnJgifPreprocessor() {
        // utility class
    }

    /**
     * Returns a mapped copy of a CBN JGIF document; the input is left unchanged.
     */
    public static JsonNode preprocess(JsonNode root) {
        JsonNode copy = root.deepCopy();
        JsonNode graph = copy.path("graph");
        if (!graph.isObject()) {
            return copy;
        }

        JsonNode metadata = graph.get("metadata");
        ObjectNode metadataNode = metadata instanceof ObjectNode object
                ? object
                : ((ObjectNode) graph).putObject("metadata");
        metadataNode.put("Authors", AUTHORS);
        metadataNode.put("Licenses", LICENSES);

        for (JsonNode edge : graph.path("edges")) {
            for (JsonNode evidence : edge.path("metadata").path("evidences")) {
                JsonNode experimentContext = evidence.get(JgifImporter.EXPERIMENT_CONTEXT);
                if (evidence instanceof ObjectNode evidenceNode && experimentContext != null
                        && experimentContext.isObject()) {
                    evidenceNode.set(JgifImporter.EXPERIMENT_CONTEXT, mapContext(experimentContext, evidenceNode));
                }
            }
        }
        return copy;
    }

    private static ObjectNode mapContext(JsonNode experimentContext, ObjectNode owner) {
        ObjectNode mapped = owner.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = experimentContext.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String value = field.getValue().isValueNode() ? field.getValue().asText().strip() : "";
            if (value.isEmpty()) {
                log.debug("cbn.context.skipped key={} reason=blank", field.getKey());
                continue;
            }
            String key = field.getKey().strip().toLowerCase(Locale.ROOT);
            if ("species_common_name".equals(key)) {
                String taxonomyId = SPECIES.get(value.toLowerCase(Locale.ROOT));
                if (taxonomyId == null) {
                    log.debug("cbn.species.unmapped value={}", value);
                    taxonomyId = value;
                }
                mapped.put(ANNOTATION_KEYS.get(key), taxonomyId);
            } else {
                mapped.put(ANNOTATION_KEYS.getOrDefault(key, key), value);
            }
        }
        return mapped;
    }
}
