package org.proxml.xml;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.apache.log4j.Logger;
import org.proxml.io.FilePosition;
import org.proxml.io.LineIndex;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * <p>
 * Builds the element tree and the normalized text of one document from the {@link ScannerEvent events} of a scanner, in lock-step with
 * the scan. All the state of a parse lives in its session, so sessions for different documents are independent.
 * </p>
 * <p>
 * The session keeps a stack of open elements whose bottom is the synthetic {@link XmlElement#isDocumentRoot() document root}. It also
 * keeps the position of the last markup boundary: character data is measured from there to the end of the data. The boundary moves at
 * the end of every start tag, end tag, CDATA section, comment and processing instruction, so that text following a nested element is
 * measured from that element's end tag rather than from its parent's start tag.
 * </p>
 */
public class ParseSession implements Consumer<ScannerEvent> {
	private static final Logger log = Logger.getLogger(ParseSession.class);

	private final String theSourceText;
	private final LineIndex theLineIndex;
	private final XmlParseConfig theConfig;
	private final XmlElement theRoot;
	private final Deque<XmlElement> theStack;
	private final TextProvenanceTracker theTracker;

	private int theBoundaryLine;
	private int theBoundaryColumn;
	private InterruptedParseException theError;
	private int theEventCount;
	private boolean isFinished;

	/**
	 * @param sourceText The source text of the document
	 * @param lineIndex The line index of the source text
	 * @param config The parse configuration
	 */
	public ParseSession(String sourceText, LineIndex lineIndex, XmlParseConfig config) {
		theSourceText = sourceText;
		theLineIndex = lineIndex;
		theConfig = config;
		theRoot = XmlElement.createDocumentRoot();
		theStack = new ArrayDeque<>();
		theStack.push(theRoot);
		theTracker = new TextProvenanceTracker(sourceText, lineIndex);
		theBoundaryLine = theBoundaryColumn = -1;
	}

	/** @return The number of elements currently open, not counting the document root */
	public int getDepth() {
		return theStack.size() - 1;
	}

	/** @return The first error reported to this session, or null if none has been */
	public InterruptedParseException getError() {
		return theError;
	}

	@Override
	public void accept(ScannerEvent event) {
		Preconditions.checkState(!isFinished, "Session is finished");
		theEventCount++;
		switch (event.getType()) {
		case ELEMENT_START:
			ScannerEvent.ElementStart start = (ScannerEvent.ElementStart) event;
			elementStart(start.getName(), start.getAttributes(), start.getLine(), start.getColumn());
			break;
		case CHARACTERS:
			characters(((ScannerEvent.Characters) event).getText(), event.getLine(), event.getColumn());
			break;
		case CDATA:
			cdata(((ScannerEvent.Cdata) event).getData(), event.getLine(), event.getColumn());
			break;
		case ELEMENT_END:
			elementEnd(((ScannerEvent.ElementEnd) event).getName(), event.getLine(), event.getColumn());
			break;
		case SKIPPED_MARKUP:
			moveBoundary(event.getLine(), event.getColumn());
			break;
		case PARSE_ERROR:
			parseError(((ScannerEvent.ParseError) event).getError());
			break;
		}
	}

	private void elementStart(String scannedName, Map<String, String> attributes, int line, int column) {
		String name = theConfig.getElementName(scannedName);
		XmlElement parent = theStack.peek();
		XmlElement element = new XmlElement(parent, name, attributes, line);
		parent.addChild(element);
		theStack.push(element);
		moveBoundary(line, column);

		if (theConfig.getParagraphElements().contains(name) && theTracker.length() > 0)
			theTracker.appendLineBreak();
		if (theConfig.getLineBreakElements().contains(name))
			theTracker.appendLineBreak();
	}

	private void characters(String text, int line, int column) {
		theStack.peek().appendText(text);
		if (CharMatcher.whitespace().trimFrom(text).isEmpty())
			return;
		if (theBoundaryLine < 0) {
			log.debug("Character data before any markup; provenance not recorded");
			return;
		}
		theTracker.record(theBoundaryLine, theBoundaryColumn, line, column);
	}

	private void cdata(byte[] data, int line, int column) {
		theStack.peek().setCdata(data);
		moveBoundary(line, column);
	}

	private void elementEnd(String scannedName, int line, int column) {
		XmlElement element = theStack.peek();
		Preconditions.checkState(!element.isDocumentRoot(), "End of element %s with no element open", scannedName);
		String name = theConfig.getElementName(scannedName);
		Preconditions.checkState(element.getName().equals(name), "End of element %s while %s is open", name, element.getName());
		element.close(line, theConfig.getTrimming());
		theStack.pop();
		moveBoundary(line, column);
	}

	private void moveBoundary(int line, int column) {
		theBoundaryLine = line;
		theBoundaryColumn = column;
	}

	private void parseError(InterruptedParseException error) {
		if (theError == null)
			theError = error;
		else if (log.isDebugEnabled())
			log.debug("Ignoring error after the first: " + error.getMessage());
	}

	/**
	 * Called when the scanner has no more events
	 *
	 * @return The result of the parse
	 */
	public XmlParseResult finish() {
		Preconditions.checkState(!isFinished, "Session is already finished");
		isFinished = true;
		if (theError == null && theStack.size() > 1) {
			XmlElement open = theStack.peek();
			theError = new InterruptedParseException("Document ended with " + getDepth() + " unclosed element(s), innermost " + open.getName(),
				theLineIndex.getPosition(theLineIndex.length()), null);
		}
		if (theError != null) {
			if (log.isDebugEnabled())
				log.debug("Parse interrupted after " + theEventCount + " events: " + theError.getMessage());
			return XmlParseResult.interrupted(theError);
		}

		theRoot.seal();
		ParsedXmlDocument document = new ParsedXmlDocument(theRoot, theSourceText, theLineIndex, theTracker.getText(),
			theTracker.getMappings());
		assert checkProvenance(document) : "Normalized text does not match its source";
		if (log.isDebugEnabled())
			log.debug("Parsed " + theEventCount + " events into " + document.getText().length() + " chars of text with "
				+ document.getMappings().size() + " mappings");
		return XmlParseResult.success(document);
	}

	private static boolean checkProvenance(ParsedXmlDocument document) {
		List<RangeMapping> violations = document.findMappingViolations();
		for (RangeMapping violation : violations) {
			FilePosition position = document.getLineIndex()
				.getPosition(Math.min(violation.getOriginalStart(), document.getLineIndex().length()));
			log.error("Mapping " + violation + " at " + position + " does not match the source text");
		}
		return violations.isEmpty();
	}
}
