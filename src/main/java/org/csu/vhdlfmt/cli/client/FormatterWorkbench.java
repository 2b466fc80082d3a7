package org.csu.vhdlfmt.cli.client;

import org.csu.vhdlfmt.common.exception.FormatterContractException;
import org.csu.vhdlfmt.common.exception.ParseException;
import org.csu.vhdlfmt.compiler.lexer.TokenKind;
import org.csu.vhdlfmt.formatter.VhdlFormatter;
import org.fife.ui.autocomplete.AutoCompletion;
import org.fife.ui.autocomplete.BasicCompletion;
import org.fife.ui.autocomplete.CompletionProvider;
import org.fife.ui.autocomplete.DefaultCompletionProvider;
import org.fife.ui.rsyntaxtextarea.RSyntaxTextArea;
import org.fife.ui.rsyntaxtextarea.SyntaxConstants;
import org.fife.ui.rsyntaxtextarea.Theme;
import org.fife.ui.rtextarea.RTextScrollPane;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.awt.event.ActionEvent;
import java.awt.event.KeyEvent;
import java.awt.event.MouseWheelEvent;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Comparator;
import java.util.concurrent.ExecutionException;

/**
 * 基于 GUI 的格式化工作台：左侧编辑源码，右侧显示格式化结果
 */
public class FormatterWorkbench extends JFrame {

    private static final Logger log = LoggerFactory.getLogger(FormatterWorkbench.class);

    private final VhdlFormatter formatter;

    // --- UI Components ---
    private RSyntaxTextArea sourceEditor;
    private RSyntaxTextArea resultView;
    private JLabel statusBar;

    private File currentFile;

    public FormatterWorkbench(VhdlFormatter formatter) {
        super("VHDL 配置声明格式化工作台");
        this.formatter = formatter;
        initComponents();
        setupAutoCompletion();
        layoutComponents();
        addListeners();

        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        setSize(1200, 800);
        setLocationRelativeTo(null);
    }

    private void initComponents() {
        sourceEditor = createEditor(true);
        resultView = createEditor(false);
        statusBar = new JLabel("就绪");
    }

    private RSyntaxTextArea createEditor(boolean editable) {
        RSyntaxTextArea editor = new RSyntaxTextArea(20, 60);
        editor.setSyntaxEditingStyle(SyntaxConstants.SYNTAX_STYLE_NONE);
        try (InputStream in = getClass().getResourceAsStream("/org/fife/ui/rsyntaxtextarea/themes/monokai.xml")) {
            Theme.load(in).apply(editor);
        } catch (IOException e) {
            log.warn("Cannot load editor theme, falling back to default", e);
        }
        editor.setEditable(editable);
        editor.setTabSize(4);
        editor.setFont(new Font("Consolas", Font.PLAIN, 16));
        return editor;
    }

    private void setupAutoCompletion() {
        AutoCompletion ac = new AutoCompletion(createCompletionProviderFromTokenKind());
        ac.setAutoActivationEnabled(true);
        ac.setAutoActivationDelay(300);
        ac.setChoicesWindowSize(350, 240);
        ac.install(sourceEditor);
    }

    private CompletionProvider createCompletionProviderFromTokenKind() {
        DefaultCompletionProvider provider = new DefaultCompletionProvider();
        TokenKind.keywords().stream()
                .sorted(Comparator.comparing(Enum::name))
                .forEach(kind -> provider.addCompletion(new BasicCompletion(provider, kind.name().toLowerCase())));
        return provider;
    }

    private void layoutComponents() {
        JToolBar toolBar = new JToolBar();
        toolBar.setFloatable(false);
        toolBar.setMargin(new Insets(5, 5, 5, 5));

        JButton formatButton = new JButton("格式化 (F5)");
        formatButton.addActionListener(e -> formatSource());
        toolBar.add(formatButton);

        JButton openButton = new JButton("打开文件");
        openButton.addActionListener(e -> openFile());
        toolBar.add(openButton);

        JButton saveButton = new JButton("保存结果");
        saveButton.addActionListener(e -> saveResult());
        toolBar.add(saveButton);

        JButton clearButton = new JButton("清空");
        clearButton.addActionListener(e -> {
            sourceEditor.setText("");
            resultView.setText("");
        });
        toolBar.add(clearButton);

        JSplitPane mainSplitPane = new JSplitPane(JSplitPane.HORIZONTAL_SPLIT,
                new RTextScrollPane(sourceEditor), new RTextScrollPane(resultView));
        mainSplitPane.setResizeWeight(0.5);
        mainSplitPane.setBorder(null);

        JPanel statusPanel = new JPanel(new FlowLayout(FlowLayout.LEFT));
        statusPanel.add(statusBar);

        setLayout(new BorderLayout());
        add(toolBar, BorderLayout.NORTH);
        add(mainSplitPane, BorderLayout.CENTER);
        add(statusPanel, BorderLayout.SOUTH);
    }

    private void addListeners() {
        sourceEditor.getInputMap().put(KeyStroke.getKeyStroke(KeyEvent.VK_F5, 0), "format");
        sourceEditor.getActionMap().put("format", new AbstractAction() {
            @Override
            public void actionPerformed(ActionEvent e) {
                formatSource();
            }
        });

        sourceEditor.addMouseWheelListener((MouseWheelEvent e) -> {
            if (e.isControlDown()) {
                Font font = sourceEditor.getFont();
                int newSize = font.getSize() - e.getWheelRotation();
                if (newSize > 8 && newSize < 48) {
                    Font resized = new Font(font.getName(), font.getStyle(), newSize);
                    sourceEditor.setFont(resized);
                    resultView.setFont(resized);
                }
            } else {
                JScrollPane scrollPane = (JScrollPane) SwingUtilities.getAncestorOfClass(JScrollPane.class, sourceEditor);
                if (scrollPane != null) {
                    scrollPane.dispatchEvent(SwingUtilities.convertMouseEvent(sourceEditor, e, scrollPane));
                }
            }
        });
    }

    private void formatSource() {
        String source = sourceEditor.getText();
        if (source.isBlank()) {
            return;
        }
        statusBar.setText("正在格式化...");
        SwingWorker<String, Void> worker = new SwingWorker<>() {
            @Override
            protected String doInBackground() {
                return formatter.format(source);
            }

            @Override
            protected void done() {
                try {
                    String formatted = get();
                    resultView.setText(formatted);
                    resultView.setCaretPosition(0);
                    statusBar.setText(formatted.equals(source) ? "源码已是格式化后的样子" : "格式化完成");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    statusBar.setText("格式化被中断");
                } catch (ExecutionException e) {
                    showFailure(e.getCause());
                }
            }
        };
        worker.execute();
    }

    private void showFailure(Throwable cause) {
        if (cause instanceof ParseException parseError) {
            statusBar.setText("语法错误");
            if (parseError.getLine() > 0) {
                moveCaretTo(parseError.getLine());
            }
            JOptionPane.showMessageDialog(this, parseError.getMessage(), "语法错误", JOptionPane.ERROR_MESSAGE);
        } else if (cause instanceof FormatterContractException contractError) {
            statusBar.setText("格式化器内部错误");
            log.error("Internal formatter error", contractError);
            JOptionPane.showMessageDialog(this, contractError.getMessage(), "格式化器内部错误", JOptionPane.ERROR_MESSAGE);
        } else {
            statusBar.setText("格式化失败");
            log.error("Formatting failed", cause);
            JOptionPane.showMessageDialog(this, String.valueOf(cause), "格式化失败", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void moveCaretTo(int line) {
        try {
            sourceEditor.setCaretPosition(sourceEditor.getLineStartOffset(line - 1));
        } catch (javax.swing.text.BadLocationException e) {
            log.debug("Line {} is outside the editor", line, e);
        }
    }

    private void openFile() {
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("请选择 VHDL 源文件");
        chooser.setFileFilter(new FileNameExtensionFilter("VHDL (*.vhd, *.vhdl)", "vhd", "vhdl"));
        if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        File file = chooser.getSelectedFile();
        try {
            sourceEditor.setText(Files.readString(file.toPath(), StandardCharsets.UTF_8));
            sourceEditor.setCaretPosition(0);
            currentFile = file;
            statusBar.setText("已打开 " + file.getName());
        } catch (IOException e) {
            log.error("Cannot read {}", file, e);
            JOptionPane.showMessageDialog(this, "读取文件失败: " + e.getMessage(), "错误", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void saveResult() {
        if (resultView.getText().isEmpty()) {
            JOptionPane.showMessageDialog(this, "请先格式化。", "提示", JOptionPane.INFORMATION_MESSAGE);
            return;
        }
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("保存格式化结果");
        if (currentFile != null) {
            chooser.setSelectedFile(currentFile);
        }
        if (chooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        File file = chooser.getSelectedFile();
        try {
            Files.writeString(file.toPath(), resultView.getText(), StandardCharsets.UTF_8);
            statusBar.setText("已保存到 " + file.getName());
        } catch (IOException e) {
            log.error("Cannot write {}", file, e);
            JOptionPane.showMessageDialog(this, "保存失败: " + e.getMessage(), "错误", JOptionPane.ERROR_MESSAGE);
        }
    }
}
