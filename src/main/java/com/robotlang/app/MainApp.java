package com.robotlang.app;

import com.robotlang.check.RobotProgramValidator;
import com.robotlang.config.RobotLangProperties;
import com.robotlang.exception.LexicalException;
import com.robotlang.model.ValidationResult;
import com.robotlang.parser.Programs;
import com.robotlang.parser.Token;
import com.robotlang.parser.Tokenizer;
import javafx.application.Application;
import javafx.stage.Stage;

import javafx.concurrent.Task;
import javafx.stage.FileChooser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

public class MainApp extends Application {

    private static final Logger logger = LoggerFactory.getLogger(MainApp.class);

    private final RobotProgramValidator validator = new RobotProgramValidator(RobotLangProperties.load());

    @Override
    public void start(Stage stage) {

        var openBtn = new javafx.scene.control.Button("Open a Program");
        var statusLabel = new javafx.scene.control.Label("No Program Loaded");

        var topRow = new javafx.scene.layout.HBox(10, openBtn, statusLabel);
        topRow.setPadding(new javafx.geometry.Insets(10));

        var overviewTable = new javafx.scene.control.TableView<OverviewRow>();
        overviewTable.setColumnResizePolicy(javafx.scene.control.TableView.CONSTRAINED_RESIZE_POLICY);

        var statCol = new javafx.scene.control.TableColumn<OverviewRow, String>("Item");
        statCol.setCellValueFactory(cell ->
                new javafx.beans.property.ReadOnlyStringWrapper(cell.getValue().item())
        );

        var valueCol = new javafx.scene.control.TableColumn<OverviewRow, String>("Value");
        valueCol.setCellValueFactory(cell ->
                new javafx.beans.property.ReadOnlyStringWrapper(cell.getValue().value())
        );

        overviewTable.getColumns().addAll(statCol, valueCol);
        overviewTable.setPlaceholder(new javafx.scene.control.Label("Open a program to validate it."));

        var tokensTable = new javafx.scene.control.TableView<TokenRow>();
        tokensTable.setColumnResizePolicy(javafx.scene.control.TableView.CONSTRAINED_RESIZE_POLICY);

        var posCol = new javafx.scene.control.TableColumn<TokenRow, String>("Line:Col");
        posCol.setCellValueFactory(cell ->
                new javafx.beans.property.ReadOnlyStringWrapper(cell.getValue().position())
        );

        var typeCol = new javafx.scene.control.TableColumn<TokenRow, String>("Type");
        typeCol.setCellValueFactory(cell ->
                new javafx.beans.property.ReadOnlyStringWrapper(cell.getValue().type())
        );

        var textCol = new javafx.scene.control.TableColumn<TokenRow, String>("Text");
        textCol.setCellValueFactory(cell ->
                new javafx.beans.property.ReadOnlyStringWrapper(cell.getValue().text())
        );

        tokensTable.getColumns().addAll(posCol, typeCol, textCol);
        tokensTable.setPlaceholder(new javafx.scene.control.Label("Open a program to see its tokens."));

        var tabs = new javafx.scene.control.TabPane();
        tabs.getTabs().add(new javafx.scene.control.Tab("Overview", overviewTable));
        tabs.getTabs().add(new javafx.scene.control.Tab("Tokens", tokensTable));
        tabs.setTabClosingPolicy(javafx.scene.control.TabPane.TabClosingPolicy.UNAVAILABLE);

        var logArea = new javafx.scene.control.TextArea();
        logArea.setEditable(false);
        logArea.setPrefRowCount(6);
        logArea.appendText("Robot program validator initialised.\n");

        openBtn.setOnAction(e -> {
            FileChooser chooser = new FileChooser();
            chooser.setTitle("Select a Program File");
            chooser.getExtensionFilters().addAll(
                    new FileChooser.ExtensionFilter("Robot programs", "*.txt", "*.robot"),
                    new FileChooser.ExtensionFilter("All files", "*.*")
            );

            var file = chooser.showOpenDialog(stage);
            if (file == null) {
                logArea.appendText("Open Cancelled.\n");
                return;
            }
            final Path selected = file.toPath();

            statusLabel.setText("Validating...");
            Task<Loaded> task = new Task<>() {
                @Override
                protected Loaded call() throws Exception {
                    String source = ProgramSource.read(selected);
                    logger.info("Loaded {} ({} chars)", selected, source.length());
                    return new Loaded(selected, validator.check(source), tokensOf(source));
                }
            };

            task.setOnSucceeded(ev -> {
                Loaded loaded = task.getValue();
                overviewTable.setItems(buildOverviewRows(loaded.result()));
                tokensTable.setItems(buildTokenRows(loaded.tokens()));
                String verdict = loaded.result().valid() ? "True" : "False";
                statusLabel.setText(loaded.file().getFileName() + ": " + verdict);
                logArea.appendText(loaded.file() + " -> " + verdict + "\n");
                loaded.result().failure().ifPresent(d -> logArea.appendText("  " + d + "\n"));
            });

            task.setOnFailed(ev -> {
                Throwable ex = task.getException();
                logger.error("Could not validate {}", selected, ex);
                logArea.appendText("Load FAILED:\n");
                logArea.appendText((ex == null ? "Unknown error" : ex.toString()) + "\n");
                statusLabel.setText("Load Failed.");
            });

            new Thread(task, "program-validator").start();
        });

        var root = new javafx.scene.layout.BorderPane();
        root.setTop(topRow);
        root.setCenter(tabs);
        root.setBottom(logArea);

        var scene = new javafx.scene.Scene(root, 900, 600);
        stage.setTitle("Robot Program Validator");
        stage.setScene(scene);
        stage.show();
    }

    private record Loaded(Path file, ValidationResult result, List<Token> tokens) {}

    private record OverviewRow(String item, String value) {}

    private record TokenRow(String position, String type, String text) {}

    // The token tab stays empty for programs that do not lex; the overview shows why.
    private static List<Token> tokensOf(String source) {
        try {
            return new Tokenizer(source).tokenize();
        } catch (LexicalException e) {
            logger.debug("No tokens to show: {}", e.getMessage());
            return List.of();
        }
    }

    private static String safe(Object o) {
        return o == null ? "(none)" : String.valueOf(o);
    }

    private static javafx.collections.ObservableList<OverviewRow> buildOverviewRows(ValidationResult r) {
        var rows = javafx.collections.FXCollections.<OverviewRow>observableArrayList();

        rows.add(new OverviewRow("Valid", r.valid() ? "True" : "False"));

        if (r.valid()) {
            var program = r.program();
            rows.add(new OverviewRow("Global Variables", String.join(", ", program.variables())));
            rows.add(new OverviewRow("Procedures", String.join(", ", program.procedureTable().keySet())));
            rows.add(new OverviewRow("Main Block Instructions", String.valueOf(program.main().instructions().size())));
            rows.add(new OverviewRow("Calls", String.valueOf(Programs.calls(program).size())));
            return rows;
        }

        var d = r.diagnostic();
        rows.add(new OverviewRow("Stage", safe(d.stage())));
        rows.add(new OverviewRow("Message", safe(d.message())));
        rows.add(new OverviewRow("Line", safe(d.line())));
        rows.add(new OverviewRow("Column", safe(d.column())));
        return rows;
    }

    private static javafx.collections.ObservableList<TokenRow> buildTokenRows(List<Token> tokens) {
        var rows = javafx.collections.FXCollections.<TokenRow>observableArrayList();
        for (Token t : tokens) {
            String type = t.category() == null ? t.type().name() : t.type() + " (" + t.category() + ")";
            rows.add(new TokenRow(t.line() + ":" + t.column(), type, t.text()));
        }
        return rows;
    }

    public static void main(String[] args) {
        launch(args);
    }
}
