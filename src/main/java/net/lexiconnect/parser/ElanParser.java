package net.lexiconnect.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.lexiconnect.exceptions.InvalidInputException;
import net.lexiconnect.model.*;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

import static net.lexiconnect.Util.UNKNOWN_LANGUAGE;
import static net.lexiconnect.Util.isEmpty;
import static net.lexiconnect.Util.tokenize;

/**
 * Parser for ELAN annotation files (.eaf). ELAN has no notion of phrases, words or
 * morphemes, so the text built here is a best-effort reconstruction: the main
 * transcription tier supplies one phrase per annotation, and dependent tiers are
 * matched to the phrase's words by position.
 */
public class ElanParser {
    private static final Logger logger = LoggerFactory.getLogger(ElanParser.class);

    private static final int FRAGMENT_LENGTH = 32;

    private static final Map<String, String> LANGUAGE_TOKENS = Map.of(
            "en", "en", "eng", "en",
            "es", "es", "spa", "es",
            "fr", "fr", "fra", "fr",
            "de", "de", "deu", "de");

    private enum ChildTierKind { GLOSS, POS, MORPH }

    public ElanDocumentModel readFile(File file) throws InvalidInputException {
        try (InputStream in = FileUtils.openInputStream(file)) {
            return readDocument(in, file.getName());
        } catch (IOException e) {
            throw new InvalidInputException(file.getName(), e.getMessage(), e);
        }
    }

    /**
     * Reads the raw tiers, annotations and header information of an ELAN file.
     *
     * @param filestream - the EAF XML
     * @param fileName - the name of the file
     * @return the document as it stands in the file
     * @throws InvalidInputException if the stream is not well-formed XML
     */
    public ElanDocumentModel readDocument(InputStream filestream, String fileName) throws InvalidInputException {
        Document doc = Util.openFileStream(filestream, fileName);
        Element root = doc.getDocumentElement();

        ElanDocumentModel result = new ElanDocumentModel(fileName);
        result.setAuthor(Util.attribute(root, "AUTHOR"));
        result.setDate(Util.attribute(root, "DATE"));

        for (Element md : Util.containedElements(root, "HEADER", "MEDIA_DESCRIPTOR")) {
            Map<String, String> attrs = new LinkedHashMap<>();
            NamedNodeMap nm = md.getAttributes();
            for (int i = 0; i < nm.getLength(); i++) {
                Node a = nm.item(i);
                attrs.put(Util.localName(a), a.getNodeValue());
            }
            result.getMedia().add(attrs);
        }

        for (Element ts : Util.containedElements(root, "TIME_ORDER", "TIME_SLOT")) {
            String slotId = Util.attribute(ts, "TIME_SLOT_ID");
            String value = Util.attribute(ts, "TIME_VALUE");
            // Unaligned slots carry no TIME_VALUE
            if (slotId != null && value != null && value.trim().matches("-?\\d{1,18}"))
                result.getTimeSlots().put(slotId, Long.parseLong(value.trim()));
        }

        for (Element tierEl : Util.childElements(root, "TIER"))
            result.getTiers().add(readTier(tierEl, result));

        logger.debug("Read {} tier(s) and {} annotation(s) from {}",
                result.getTiers().size(), result.getAnnotationCount(), fileName);
        return result;
    }

    private ElanTierModel readTier(Element tierEl, ElanDocumentModel doc) {
        String tierId = Util.attribute(tierEl, "TIER_ID");
        ElanTierModel tier = new ElanTierModel(tierId == null ? "" : tierId,
                Util.attribute(tierEl, "PARTICIPANT"),
                Util.attribute(tierEl, "LINGUISTIC_TYPE_REF"),
                Util.attribute(tierEl, "PARENT_REF"));

        for (Element wrapper : Util.childElements(tierEl, "ANNOTATION")) {
            Element align = Util.firstChild(wrapper, "ALIGNABLE_ANNOTATION");
            if (align != null) {
                Long start = lookupSlot(doc, Util.attribute(align, "TIME_SLOT_REF1"));
                Long end = lookupSlot(doc, Util.attribute(align, "TIME_SLOT_REF2"));
                String value = Util.textOf(Util.firstChild(align, "ANNOTATION_VALUE"));
                String id = Util.attribute(align, "ANNOTATION_ID");
                if (id == null || id.isEmpty())
                    id = StableIdGenerator.generate(doc.getFile(), tier.getId(),
                            String.valueOf(start == null ? 0 : start), String.valueOf(end == null ? 0 : end),
                            StableIdGenerator.fragment(value, FRAGMENT_LENGTH));
                tier.getAnnotations().add(
                        new ElanAnnotationModel(id, start, end, value.trim(), null, tier.getId()));
                continue;
            }
            Element ref = Util.firstChild(wrapper, "REF_ANNOTATION");
            if (ref != null) {
                String refId = Util.attribute(ref, "ANNOTATION_REF");
                String value = Util.textOf(Util.firstChild(ref, "ANNOTATION_VALUE"));
                String id = Util.attribute(ref, "ANNOTATION_ID");
                if (id == null || id.isEmpty())
                    id = StableIdGenerator.generate(doc.getFile(), tier.getId(), refId,
                            StableIdGenerator.fragment(value, FRAGMENT_LENGTH));
                // A reference annotation without a target is still not alignable
                tier.getAnnotations().add(
                        new ElanAnnotationModel(id, null, null, value.trim(), refId == null ? "" : refId, tier.getId()));
            }
        }
        return tier;
    }

    private static Long lookupSlot(ElanDocumentModel doc, String slotId) {
        return slotId == null ? null : doc.getTimeSlots().get(slotId);
    }

    /**
     * Parses an ELAN file and reconstructs a text from it.
     */
    public TextModel parse(InputStream filestream, String fileName) throws InvalidInputException {
        return toText(readDocument(filestream, fileName));
    }

    public TextModel parseFile(File file) throws InvalidInputException {
        return toText(readFile(file));
    }

    /**
     * Builds a text from the raw document. If there is no usable main tier, the result
     * is an empty text titled with the file name.
     *
     * @param doc - the raw ELAN document
     * @return the reconstructed text
     */
    public TextModel toText(ElanDocumentModel doc) {
        TextModel text = new TextModel();
        text.setId(StableIdGenerator.generate("elan", doc.getFile()));
        text.setTitle(doc.getFile() == null ? "" : doc.getFile());
        for (Map<String, String> media : doc.getMedia()) {
            String url = media.get("MEDIA_URL");
            if (url != null && !url.isEmpty()) {
                text.setSource(url);
                break;
            }
        }
        text.setLanguageCode(inferLanguage(doc));

        ElanTierModel mainTier = selectMainTier(doc);
        if (mainTier == null) {
            logger.info("No transcription tier found in {}; returning an empty text", doc.getFile());
            return text;
        }

        List<ElanTierModel> childTiers = doc.getTiers().stream()
                .filter(t -> mainTier.getId().equals(t.getParentRef()))
                .collect(Collectors.toList());

        List<ElanAnnotationModel> mainAnnotations = new ArrayList<>(mainTier.getAlignableAnnotations());
        mainAnnotations.sort(Comparator.comparing(ElanAnnotationModel::getStartMs,
                Comparator.nullsLast(Comparator.naturalOrder())));

        for (int i = 0; i < mainAnnotations.size(); i++) {
            ElanAnnotationModel annotation = mainAnnotations.get(i);
            SectionModel section = new SectionModel(
                    StableIdGenerator.generate("section", text.getId(), annotation.getId()), i);
            PhraseModel phrase = new PhraseModel(
                    StableIdGenerator.generate("phrase", section.getId(), annotation.getId()), annotation.getValue());
            phrase.setSegnum(String.valueOf(i + 1));
            phrase.setLanguage(text.getLanguageCode());

            List<String> tokens = tokenize(annotation.getValue());
            for (int j = 0; j < tokens.size(); j++) {
                WordModel word = new WordModel(
                        StableIdGenerator.generate("word", phrase.getId(), String.valueOf(j), tokens.get(j)),
                        tokens.get(j));
                word.setOrder(j);
                word.setLanguage(phrase.getLanguage());
                phrase.addWord(word);
            }

            for (ElanTierModel child : childTiers)
                alignChildTier(child, annotation, phrase.getWords());

            section.addPhrase(phrase);
            text.addSection(section);
        }
        return text;
    }

    // Distribute one child tier's annotations over the words of a main annotation
    private static void alignChildTier(ElanTierModel tier, ElanAnnotationModel parent, List<WordModel> words) {
        ChildTierKind kind = classify(tier);
        if (kind == null || words.isEmpty())
            return;
        List<ElanAnnotationModel> matched = tier.getAnnotations().stream()
                .filter(a -> parent.getId().equals(a.getRefId()))
                .collect(Collectors.toList());

        for (int k = 0; k < matched.size(); k++) {
            String value = matched.get(k).getValue();
            if (isEmpty(value))
                continue;
            WordModel target;
            switch (kind) {
                case GLOSS:
                    target = k < words.size() ? words.get(k) : firstWordWhere(words, w -> isEmpty(w.getGloss()));
                    if (target != null)
                        target.setGloss(value);
                    break;
                case POS:
                    target = k < words.size() ? words.get(k) : firstWordWhere(words, w -> w.getPos().isEmpty());
                    if (target != null)
                        target.setPos(Arrays.stream(value.split(","))
                                .map(String::trim)
                                .filter(s -> !s.isEmpty())
                                .collect(Collectors.toList()));
                    break;
                case MORPH:
                    target = k < words.size() ? words.get(k) : words.get(0);
                    MorphemeModel morpheme = new MorphemeModel(
                            StableIdGenerator.generate("morph", target.getId(), matched.get(k).getId()),
                            MorphemeType.OTHER, value);
                    morpheme.setOrder(target.getMorphemes().size());
                    morpheme.setLanguage(target.getLanguage());
                    target.addMorpheme(morpheme);
                    break;
            }
        }
    }

    private static WordModel firstWordWhere(List<WordModel> words, java.util.function.Predicate<WordModel> test) {
        for (WordModel w : words)
            if (test.test(w))
                return w;
        return null;
    }

    private static ChildTierKind classify(ElanTierModel tier) {
        String key = (Objects.toString(tier.getLinguisticTypeRef(), "") + " " + tier.getId()).toLowerCase(Locale.ROOT);
        if (key.contains("gloss") || key.contains("gls"))
            return ChildTierKind.GLOSS;
        if (key.contains("pos") || key.contains("part"))
            return ChildTierKind.POS;
        if (key.contains("morph"))
            return ChildTierKind.MORPH;
        return null;
    }

    /**
     * Picks the tier that holds the transcription: a top-level tier with alignable
     * annotations, else the tier most often named as a parent, else any tier with
     * alignable annotations.
     *
     * @return the tier, or null if there is none
     */
    ElanTierModel selectMainTier(ElanDocumentModel doc) {
        for (ElanTierModel t : doc.getTiers())
            if (isBlank(t.getParentRef()) && t.hasAlignableAnnotations())
                return t;

        Map<String, Integer> parentCounts = new LinkedHashMap<>();
        for (ElanTierModel t : doc.getTiers())
            if (!isBlank(t.getParentRef()))
                parentCounts.merge(t.getParentRef(), 1, Integer::sum);
        String mostReferenced = null;
        int best = 0;
        for (Map.Entry<String, Integer> e : parentCounts.entrySet()) {
            if (e.getValue() > best && doc.getTier(e.getKey()) != null) {
                mostReferenced = e.getKey();
                best = e.getValue();
            }
        }
        if (mostReferenced != null)
            return doc.getTier(mostReferenced);

        for (ElanTierModel t : doc.getTiers())
            if (t.hasAlignableAnnotations())
                return t;
        return null;
    }

    // Match whole tokens of tier types and names, so that e.g. "sentence" does not read as "en"
    static String inferLanguage(ElanDocumentModel doc) {
        for (ElanTierModel t : doc.getTiers()) {
            String names = Objects.toString(t.getLinguisticTypeRef(), "") + " " + t.getId();
            for (String token : names.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
                String code = LANGUAGE_TOKENS.get(token);
                if (code != null)
                    return code;
            }
        }
        return UNKNOWN_LANGUAGE;
    }

    /**
     * Serializes the raw document, for inspection of what the file contains.
     */
    public String toJson(ElanDocumentModel doc) throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        return mapper.writeValueAsString(doc);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
