package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.Score;
import net.scoreworks.mtn.translation.MusicXmlTranslator;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.InputStream;
import java.util.Collections;

/**
 * Scores translated from the MusicXML files of the test resources
 */
final class TranslatedScores {

    private TranslatedScores() {}

    static Score translate(String name) throws Exception {
        try (InputStream stream = TranslatedScores.class.getResourceAsStream("/mxml/" + name)) {
            Element root = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(stream).getDocumentElement();
            return new MusicXmlTranslator().translate(root, name, Collections.emptySet());
        }
    }
}
