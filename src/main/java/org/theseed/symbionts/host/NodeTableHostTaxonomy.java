/**
 *
 */
package org.theseed.symbionts.host;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.symbionts.utils.ParseFailureException;
import org.theseed.symbionts.utils.TabbedLineReader;

/**
 * This host taxonomy is loaded from a node table, a tab-delimited file with headers containing
 * (0) a taxonomic ID, (1) the parent taxonomic ID, (2) the rank, and (3) the scientific name.
 * This is the layout of the insect subset of the NCBI taxonomy.  A host name is resolved by
 * finding its node and walking the parent links up to the root, picking up the order, family,
 * genus, and species names along the way.
 *
 */
public class NodeTableHostTaxonomy implements IHostTaxonomy {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NodeTableHostTaxonomy.class);
    /** map of taxonomic IDs to nodes */
    private final Map<String, Node> nodeMap;
    /** map of lower-case names to taxonomic IDs */
    private final Map<String, String> nameMap;

    /**
     * This class represents a single taxonomy node.
     */
    private static class Node {

        /** parent ID */
        private final String parentId;
        /** rank name */
        private final String rank;
        /** scientific name */
        private final String name;

        private Node(String parentId, String rank, String name) {
            this.parentId = parentId;
            this.rank = rank;
            this.name = name;
        }

    }

    /**
     * Create an empty host taxonomy.
     */
    public NodeTableHostTaxonomy() {
        this.nodeMap = new HashMap<String, Node>();
        this.nameMap = new HashMap<String, String>();
    }

    /**
     * Load a host taxonomy from a node table file.
     *
     * @param inFile	node table file
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    public NodeTableHostTaxonomy(File inFile) throws IOException, ParseFailureException {
        this();
        log.info("Loading host taxonomy from {}.", inFile);
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            if (inStream.size() < 4)
                throw new ParseFailureException("Host taxonomy file " + inFile + " must have four columns.");
            int idCol = inStream.findColumn("tax_id", 0);
            int parentCol = inStream.findColumn("parent_id", 1);
            int rankCol = inStream.findColumn("rank", 2);
            int nameCol = inStream.findColumn("name", 3);
            for (TabbedLineReader.Line line : inStream)
                this.addNode(line.get(idCol), line.get(parentCol), line.get(rankCol), line.get(nameCol));
        }
        log.info("{} host taxonomy nodes loaded.", this.nodeMap.size());
    }

    /**
     * Add a node to this taxonomy.  If two nodes have the same name, the first one is used for
     * name lookups.
     *
     * @param taxId		taxonomic ID
     * @param parentId	parent taxonomic ID
     * @param rank		rank name
     * @param name		scientific name
     */
    public void addNode(String taxId, String parentId, String rank, String name) {
        this.nodeMap.put(taxId, new Node(parentId, rank.toLowerCase(), name));
        this.nameMap.putIfAbsent(StringUtils.normalizeSpace(name).toLowerCase(), taxId);
    }

    @Override
    public HostProfile resolve(String name) {
        HostProfile retVal = null;
        String taxId = (name == null ? null : this.nameMap.get(StringUtils.normalizeSpace(name).toLowerCase()));
        if (taxId != null) {
            String order = null;
            String family = null;
            String genus = null;
            String species = null;
            Set<String> visited = new HashSet<String>();
            Node node = this.nodeMap.get(taxId);
            while (node != null && visited.add(taxId)) {
                switch (node.rank) {
                case "order" -> order = node.name;
                case "family" -> family = node.name;
                case "genus" -> genus = node.name;
                case "species" -> species = node.name;
                default -> { }
                }
                taxId = node.parentId;
                node = this.nodeMap.get(taxId);
            }
            retVal = new HostProfile(name, order, family, genus, species);
            log.debug("Host {} resolved to {}.", name, retVal);
        }
        return retVal;
    }

    /**
     * @return the number of nodes in this taxonomy
     */
    public int size() {
        return this.nodeMap.size();
    }

}
