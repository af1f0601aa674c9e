package de.uos.ikw.izpb.nlp;

import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.ling.IndexedWord;
import edu.stanford.nlp.pipeline.CoreDocument;
import edu.stanford.nlp.pipeline.CoreSentence;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.semgraph.SemanticGraph;
import edu.stanford.nlp.semgraph.SemanticGraphCoreAnnotations;
import edu.stanford.nlp.semgraph.SemanticGraphEdge;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency parser backed by the CoreNLP German models (universal dependencies, basic relations).
 */
public class CoreNlpDependencyParser implements DependencyParser {
    private static final String ANNOTATORS = "tokenize,ssplit,mwt,pos,depparse";

    private final StanfordCoreNLP pipeline;

    /**
     * @param propertiesResource Classpath resource with the CoreNLP language settings.
     */
    public CoreNlpDependencyParser(String propertiesResource) {
        this.pipeline = CoreNlpSettings.pipeline(propertiesResource, ANNOTATORS);
    }

    @Override
    public List<List<ParsedToken>> parse(String text) {
        if (text.isBlank()) {
            return List.of();
        }
        CoreDocument document = new CoreDocument(text);
        pipeline.annotate(document);

        List<List<ParsedToken>> sentences = new ArrayList<>();
        for (CoreSentence sentence : document.sentences()) {
            SemanticGraph graph = sentence.coreMap().get(SemanticGraphCoreAnnotations.BasicDependenciesAnnotation.class);
            Map<Integer, SemanticGraphEdge> heads = new HashMap<>();
            List<Integer> roots = new ArrayList<>();
            if (graph != null) {
                for (SemanticGraphEdge edge : graph.edgeIterable()) {
                    heads.put(edge.getDependent().index(), edge);
                }
                for (IndexedWord root : graph.getRoots()) {
                    roots.add(root.index());
                }
            }

            List<ParsedToken> tokens = new ArrayList<>();
            for (CoreLabel label : sentence.tokens()) {
                int head = -1;
                String relation = "";
                SemanticGraphEdge edge = heads.get(label.index());
                if (edge != null) {
                    head = edge.getGovernor().index();
                    relation = edge.getRelation().toString();
                } else if (roots.contains(label.index())) {
                    head = 0;
                    relation = "root";
                }
                String pos = label.tag() == null ? "" : label.tag();
                tokens.add(new ParsedToken(label.index(), label.beginPosition(), label.endPosition(), label.word(),
                        pos, head, relation));
            }
            sentences.add(tokens);
        }
        return sentences;
    }
}
