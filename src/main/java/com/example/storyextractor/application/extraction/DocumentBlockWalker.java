package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.model.DocumentBlock;
import com.example.storyextractor.domain.model.EpicMarker;
import com.example.storyextractor.domain.model.ParagraphBlock;
import com.example.storyextractor.domain.model.RequirementsTables;
import com.example.storyextractor.domain.model.StoryMarker;
import com.example.storyextractor.domain.model.TableBlock;
import com.example.storyextractor.domain.model.TableRow;
import com.example.storyextractor.domain.model.UserStory;
import com.example.storyextractor.domain.text.UnicodeText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Walks the paragraphs and tables of a document in their original order and turns them into the Stories and
 * Acceptance Criteria tables.
 * Epic and story headings update the current context; every AC table is attributed to the story that is current
 * when the table is reached. Tables that appear before the first story are skipped.
 */
@Component
public class DocumentBlockWalker {

    private static final Logger log = LoggerFactory.getLogger(DocumentBlockWalker.class);

    private final MarkerMatcher markerMatcher;
    private final ModuleNameDetector moduleNameDetector;
    private final AcceptanceTableClassifier tableClassifier;
    private final DataRowSegmenter rowSegmenter;
    private final ColumnInferencer columnInferencer;

    public DocumentBlockWalker(MarkerMatcher markerMatcher,
                               ModuleNameDetector moduleNameDetector,
                               AcceptanceTableClassifier tableClassifier,
                               DataRowSegmenter rowSegmenter,
                               ColumnInferencer columnInferencer) {
        this.markerMatcher = markerMatcher;
        this.moduleNameDetector = moduleNameDetector;
        this.tableClassifier = tableClassifier;
        this.rowSegmenter = rowSegmenter;
        this.columnInferencer = columnInferencer;
    }

    /**
     * Creates a walker with default collaborators, for use outside the Spring context.
     *
     * @return ready to use walker
     */
    public static DocumentBlockWalker withDefaults() {
        DataRowSegmenter segmenter = new DataRowSegmenter();
        return new DocumentBlockWalker(
                new MarkerMatcher(),
                new ModuleNameDetector(),
                new AcceptanceTableClassifier(),
                segmenter,
                new ColumnInferencer(new HeaderCanonicalizer(), segmenter)
        );
    }

    /**
     * Extracts stories and acceptance criteria from an ordered block sequence.
     * Context lives in local variables only, so every call starts fresh.
     *
     * @param blocks document blocks in document order
     * @return output tables; both are empty when the document has no paragraphs
     */
    public RequirementsTables walk(List<DocumentBlock> blocks) {
        if (blocks == null || blocks.stream().noneMatch(ParagraphBlock.class::isInstance)) {
            return RequirementsTables.empty();
        }

        String module = moduleNameDetector.detect(blocks);
        StoryAggregator aggregator = new StoryAggregator();
        String currentEpic = null;
        UserStory currentStory = null;

        for (DocumentBlock block : blocks) {
            if (block instanceof ParagraphBlock paragraph) {
                String line = UnicodeText.strip(paragraph.text());
                if (line.isEmpty()) {
                    continue;
                }
                Optional<EpicMarker> epic = markerMatcher.matchEpic(line);
                if (epic.isPresent()) {
                    currentEpic = epic.get().label();
                    continue;
                }
                Optional<StoryMarker> story = markerMatcher.matchStory(line);
                if (story.isPresent()) {
                    currentStory = new UserStory(
                            module,
                            currentEpic != null ? currentEpic : RequirementsTables.UNKNOWN,
                            story.get().storyId(),
                            story.get().title()
                    );
                    aggregator.addStory(currentStory);
                }
            } else if (block instanceof TableBlock table) {
                if (currentStory == null) {
                    log.debug("Skipping table with {} rows found before the first story", table.rowCount());
                    continue;
                }
                processTable(table, currentStory, aggregator);
            }
        }
        return aggregator.toTables(module);
    }

    /**
     * Counts and parses one table on behalf of the current story.
     *
     * @param table      table block
     * @param story      story owning the table
     * @param aggregator collector for AC rows
     */
    private void processTable(TableBlock table, UserStory story, StoryAggregator aggregator) {
        TableClassification classification = tableClassifier.classify(table);
        if (!classification.acceptanceTable()) {
            log.debug("Table under story {} is not an acceptance criteria table", story.getStoryId());
            return;
        }
        int headerRowIndex = classification.headerRowIndex();
        RowRange range = rowSegmenter.dataRowRange(table, headerRowIndex);
        story.addAcceptanceCriteria(rowSegmenter.countNonBlankRows(table, range));

        ColumnLayout layout = columnInferencer.locateColumns(table, headerRowIndex);
        for (int rowIndex = range.start(); rowIndex < range.end(); rowIndex++) {
            TableRow row = table.row(rowIndex);
            if (row.isBlank()) {
                continue;
            }
            String acNumber = layout.acNumberOf(row);
            String scenario = layout.scenarioOf(row);
            if (!acNumber.isEmpty() || !scenario.isEmpty()) {
                aggregator.addAcceptanceCriterion(story.criterion(acNumber, scenario));
            }
        }
    }
}
