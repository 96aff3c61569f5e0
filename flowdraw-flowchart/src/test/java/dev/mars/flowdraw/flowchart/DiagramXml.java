/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.flowdraw.flowchart;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathFactory;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads emitted documents back for assertions.
 */
final class DiagramXml {

    private final Document document;

    private DiagramXml(Document document) {
        this.document = document;
    }

    static DiagramXml parse(String xml) throws Exception {
        Document doc = DocumentBuilderFactory.newInstance()
                .newDocumentBuilder()
                .parse(new InputSource(new StringReader(xml)));
        return new DiagramXml(doc);
    }

    Element root() {
        return document.getDocumentElement();
    }

    List<Element> select(String expression) throws Exception {
        NodeList nodes = (NodeList) XPathFactory.newInstance().newXPath()
                .evaluate(expression, document, XPathConstants.NODESET);
        List<Element> result = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    List<Element> cells() throws Exception {
        return select("/mxfile/diagram/mxGraphModel/root/mxCell");
    }

    List<Element> vertices() throws Exception {
        return select("/mxfile/diagram/mxGraphModel/root/mxCell[@vertex='1']");
    }

    List<Element> edges() throws Exception {
        return select("/mxfile/diagram/mxGraphModel/root/mxCell[@edge='1']");
    }

    Element cell(String id) throws Exception {
        List<Element> found = select("/mxfile/diagram/mxGraphModel/root/mxCell[@id='" + id + "']");
        return found.isEmpty() ? null : found.get(0);
    }

    static Element geometry(Element cell) {
        NodeList children = cell.getElementsByTagName("mxGeometry");
        return children.getLength() == 0 ? null : (Element) children.item(0);
    }
}
