/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.*;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.TokenType;
import net.scoreworks.mtn.semantics.Vocabulary;
import org.apache.commons.collections4.SetUtils;
import org.apache.commons.lang3.math.Fraction;
import org.w3c.dom.Document;
import org.w3c.dom.DocumentFragment;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Writes a subtree as MTN XML. Elements are named after the node kinds, times are written as {@code delta="n/d"}
 * and tokens carry their modifiers, their staff position where it matters and their identifier as attributes.
 * <p>
 * Numbers and time signature fractions have no element of their own, they are returned as a
 * {@link DocumentFragment} whose children are spliced into the parent. Clefs that are not drawn, empty keys and
 * time signatures without a symbol or fractions become null and are left out
 */
public class VisitorToXml implements Visitor<Node> {
    private static final Set<TokenType> POSITIONED = SetUtils.unmodifiableSet(
            TokenType.NOTEHEAD, TokenType.REST, TokenType.ACCIDENTAL, TokenType.CLEF);

    private final boolean ignoreId;
    private final Document document;

    /**
     * @param ignoreId leave out token identifiers, as needed to compare the output of different translations
     */
    public VisitorToXml(boolean ignoreId) {
        this.ignoreId = ignoreId;
        try {
            this.document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("no XML document builder available", e);
        }
    }

    public VisitorToXml() {
        this(false);
    }

    /**
     * Document that owns every node this visitor creates
     */
    public Document getDocument() {
        return document;
    }

    /**
     * Indented text form of a node created by this visitor
     */
    public static String toXmlString(Node node) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("could not write XML", e);
        }
    }

    @Override
    public Element visitScore(Score score) {
        Element element = document.createElement("score");
        element.setAttribute("id", score.getScoreId());
        appendAll(element, score.getMeasures());
        return element;
    }

    @Override
    public Element visitMeasure(Measure measure) {
        Element element = document.createElement("measure");
        element.setAttribute("part_id", measure.getPartId());
        element.setAttribute("measure_id", measure.getMeasureId());
        element.setAttribute("staves", Integer.toString(measure.getStaves()));
        if (measure.getLeftBarline() != null)
            element.appendChild(visitBarline(measure.getLeftBarline()));
        appendAll(element, measure.getElements());
        if (measure.getRightBarline() != null)
            element.appendChild(visitBarline(measure.getRightBarline()));
        return element;
    }

    @Override
    public Element visitToken(Token token) {
        Element element = document.createElement(token.getTokenType().getValue());
        for (Map.Entry<String, Object> entry : token.getModifiers().entrySet())
            element.setAttribute(entry.getKey(), Vocabulary.valueOf(entry.getValue()));

        StaffPosition position = token.getPosition();
        if (POSITIONED.contains(token.getTokenType())) {
            // accidentals take the staff of their note or key
            if (position.getStaff() != null && token.getTokenType() != TokenType.ACCIDENTAL)
                element.setAttribute("staff", position.getStaff().toString());
            if (position.getPosition() != null)
                element.setAttribute("position", position.getPosition().toString());
        }
        if (!ignoreId)
            element.setAttribute("id", Integer.toString(token.getTokenId()));
        return element;
    }

    @Override
    public Element visitNote(Note note) {
        Element element = document.createElement("note");
        element.appendChild(visitToken(note.getNotehead()));
        appendAll(element, note.getDots());
        appendAll(element, note.getAccidentals());
        appendAll(element, note.getModifiers());
        // only the notehead is placed on the staff
        Node child = element.getFirstChild().getNextSibling();
        while (child != null) {
            if (child instanceof Element) {
                ((Element) child).removeAttribute("staff");
                ((Element) child).removeAttribute("position");
            }
            child = child.getNextSibling();
        }
        return element;
    }

    @Override
    public Element visitChord(Chord chord) {
        Element element = timed("chord", chord.getDelta());
        if (chord.getStem() != null)
            element.appendChild(visitToken(chord.getStem()));
        appendAll(element, chord.getNotes());
        return element;
    }

    @Override
    public Element visitRest(Rest rest) {
        Element element = timed("rest", rest.getDelta());
        element.appendChild(visitToken(rest.getRestToken()));
        appendAll(element, rest.getDots());
        appendAll(element, rest.getModifiers());
        return element;
    }

    @Override
    public Element visitNoteGroup(NoteGroup noteGroup) {
        Element element = timed("note_group", noteGroup.getDelta());
        appendAll(element, noteGroup.getAppendages());
        appendAll(element, noteGroup.getChildren());
        return element;
    }

    @Override
    public Element visitTuplet(Tuplet tuplet) {
        Element element = document.createElement("tuplet");
        if (tuplet.getNumber() != null)
            element.appendChild(visitNumeral(tuplet.getNumber()));
        element.appendChild(visitToken(tuplet.getTuplet()));
        return element;
    }

    @Override
    public Element visitAttributes(Attributes attributes) {
        Element element = timed("attributes", attributes.getDelta());
        appendPerStaff(element, attributes.getClefs());
        appendPerStaff(element, attributes.getKeys());
        appendPerStaff(element, attributes.getTimesigs());
        return element;
    }

    @Override
    public Element visitTimeSignature(TimeSignature timeSignature) {
        Element element = document.createElement("time_signature");
        if (timeSignature.getTimeSymbol() != null)
            element.appendChild(visitToken(timeSignature.getTimeSymbol()));
        else if (timeSignature.getCompoundTimeSignature() != null)
            appendAll(element, timeSignature.getCompoundTimeSignature());
        else
            return null;
        return element;
    }

    @Override
    public DocumentFragment visitTimesigFraction(TimesigFraction timesigFraction) {
        DocumentFragment fragment = document.createDocumentFragment();
        fragment.appendChild(visitNumerator(timesigFraction.getNumerator()));
        if (timesigFraction.getDenominator() != null)
            fragment.appendChild(visitDenominator(timesigFraction.getDenominator()));
        return fragment;
    }

    @Override
    public Element visitNumerator(Numerator numerator) {
        Element element = document.createElement("numerator");
        appendAll(element, numerator.getDigitsOrSum());
        return element;
    }

    @Override
    public Element visitDenominator(Denominator denominator) {
        Element element = document.createElement("denominator");
        element.appendChild(visitNumeral(denominator.getDigits()));
        return element;
    }

    @Override
    public DocumentFragment visitNumeral(Numeral numeral) {
        DocumentFragment fragment = document.createDocumentFragment();
        for (Token digit : numeral.getDigits())
            fragment.appendChild(visitToken(digit));
        return fragment;
    }

    @Override
    public Element visitKey(Key key) {
        if (key.getNaturals().isEmpty() && key.getAccidentals().isEmpty())
            return null;
        Element element = document.createElement("key");
        appendAll(element, key.getNaturals());
        appendAll(element, key.getAccidentals());
        return element;
    }

    @Override
    public Element visitClef(Clef clef) {
        return clef.getClefToken() == null ? null : visitToken(clef.getClefToken());
    }

    @Override
    public Element visitDirection(Direction direction) {
        Element element = timed("direction", direction.getDelta());
        appendAll(element, direction.getDirectives());
        return element;
    }

    @Override
    public Element visitBarline(Barline barline) {
        Element element = timed("barline", barline.getDelta());
        appendAll(element, barline.getBarlines());
        appendAll(element, barline.getModifiers());
        return element;
    }

    //=====PRIVATE METHODS==============================================================================================

    private Element timed(String name, Fraction delta) {
        Element element = document.createElement(name);
        element.setAttribute("delta", TimeFormat.format(delta));
        return element;
    }

    private void appendAll(Element parent, Collection<? extends SyntaxNode> children) {
        for (SyntaxNode child : children) {
            Node node = child.accept(this);
            if (node != null)
                parent.appendChild(node);
        }
    }

    private void appendPerStaff(Element parent, Map<Integer, ? extends SyntaxNode> values) {
        for (Map.Entry<Integer, ? extends SyntaxNode> entry : values.entrySet()) {
            if (entry.getValue() == null)
                continue;
            Node node = entry.getValue().accept(this);
            if (node instanceof Element) {
                ((Element) node).setAttribute("staff", entry.getKey().toString());
                parent.appendChild(node);
            }
        }
    }
}
