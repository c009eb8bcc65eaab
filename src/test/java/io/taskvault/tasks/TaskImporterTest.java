package io.taskvault.tasks;

import io.taskvault.error.ValidationException;
import io.taskvault.model.TaskDraft;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskImporterTest {
    private final TaskImporter importer = new TaskImporter();

    @Test
    void csvWithHeaderShouldProduceDrafts() {
        String csv = "title,description,project,duration,due_date\n"
                + "Write report,Quarterly numbers,Work,90,2024-05-10\n"
                + "\"Buy milk, eggs\",,Home,,5/3/2024\n";

        TaskImporter.Parsed parsed = importer.parse(TaskImporter.Format.CSV, csv);

        assertTrue(parsed.errors().isEmpty(), parsed.errors().toString());
        assertEquals(2, parsed.drafts().size());
        TaskDraft first = parsed.drafts().get(0);
        assertEquals("Write report", first.title());
        assertEquals("Work", first.project());
        assertEquals(90, first.estimatedDuration());
        assertEquals(LocalDate.of(2024, 5, 10), first.dueDate());
        TaskDraft second = parsed.drafts().get(1);
        assertEquals("Buy milk, eggs", second.title());
        assertNull(second.estimatedDuration());
        assertEquals(LocalDate.of(2024, 5, 3), second.dueDate());
    }

    @Test
    void csvRowProblemsShouldBeReportedByRow() {
        String csv = "Title,Duration,Due_Date,Extra\n"
                + ",30,,x\n"
                + "Stretch,soon,2024-13-40,y\n";

        TaskImporter.Parsed parsed = importer.parse(TaskImporter.Format.CSV, csv);

        assertEquals(1, parsed.drafts().size());
        assertEquals("Stretch", parsed.drafts().get(0).title());
        assertNull(parsed.drafts().get(0).estimatedDuration());
        assertNull(parsed.drafts().get(0).dueDate());
        assertEquals(3, parsed.errors().size());
        assertTrue(parsed.errors().get(0).startsWith("Row 2:"));
        assertTrue(parsed.errors().get(1).startsWith("Row 3: Invalid duration"));
        assertTrue(parsed.errors().get(2).startsWith("Row 3: Invalid date"));
    }

    @Test
    void pipeTextShouldSkipCommentsAndBlankLines() {
        String text = "# exported tasks\n"
                + "\n"
                + "Write report | Quarterly numbers | Work | 90 | 2024-05-10\n"
                + "Call mom\n"
                + " | no title\n"
                + "Stretch | | | many |\n";

        TaskImporter.Parsed parsed = importer.parse(TaskImporter.Format.TXT, text);

        assertEquals(3, parsed.drafts().size());
        assertEquals("Quarterly numbers", parsed.drafts().get(0).description());
        assertEquals("Call mom", parsed.drafts().get(1).title());
        assertEquals("", parsed.drafts().get(1).project());
        assertEquals(2, parsed.errors().size());
        assertEquals("Line 5: Title is required", parsed.errors().get(0));
        assertTrue(parsed.errors().get(1).startsWith("Line 6: Invalid duration"));
    }

    @Test
    void formatShouldFollowExtension() {
        assertEquals(TaskImporter.Format.CSV, TaskImporter.Format.fromFileName("Tasks.CSV"));
        assertEquals(TaskImporter.Format.TXT, TaskImporter.Format.fromFileName("list.txt"));
        assertEquals(TaskImporter.Format.TXT, TaskImporter.Format.fromString("txt"));
        assertThrows(ValidationException.class, () -> TaskImporter.Format.fromFileName("tasks.xlsx"));
        assertThrows(ValidationException.class, () -> TaskImporter.Format.fromString("json"));
    }

    @Test
    void emptyInputShouldYieldNothing() {
        assertTrue(importer.parse(TaskImporter.Format.TXT, "").drafts().isEmpty());
        assertTrue(importer.parse(TaskImporter.Format.CSV, null).drafts().isEmpty());
    }

    @Test
    void datesShouldAcceptIsoAndUsLayouts() {
        assertEquals(LocalDate.of(2024, 1, 2), TaskImporter.parseDate("2024-01-02"));
        assertEquals(LocalDate.of(2024, 12, 25), TaskImporter.parseDate("12/25/2024"));
        assertNull(TaskImporter.parseDate("25.12.2024"));
    }
}
