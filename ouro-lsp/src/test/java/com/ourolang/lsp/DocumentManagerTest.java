package com.ourolang.lsp;

import com.google.gson.JsonArray;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DocumentManager 测试")
class DocumentManagerTest {

    private static final long DEBOUNCE_MS = 100;

    private DocumentManager manager;

    @BeforeEach
    void setUp() {
        manager = new DocumentManager(new OuroAnalyzer(), DEBOUNCE_MS);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    @DisplayName("打开文档后可获取内容")
    void testOpenAndGetContent() {
        manager.open("file:///test.ouro", "var x = 1;");
        assertThat(manager.getContent("file:///test.ouro")).isEqualTo("var x = 1;");
        assertThat(manager.isOpen("file:///test.ouro")).isTrue();
    }

    @Test
    @DisplayName("未打开的文档返回 null")
    void testGetContentNotOpened() {
        assertThat(manager.getContent("file:///unknown.ouro")).isNull();
        assertThat(manager.isOpen("file:///unknown.ouro")).isFalse();
        assertThat(manager.getDiagnostics("file:///unknown.ouro")).isNull();
    }

    @Test
    @DisplayName("打开文档时立即分析")
    void testOpenAnalyzesImmediately() {
        List<String> published = new CopyOnWriteArrayList<>();
        manager.setAnalysisCallback((uri, diagnostics) -> published.add(uri));
        manager.open("file:///test.ouro", "var x: String = 1;");

        assertThat(manager.getDiagnostics("file:///test.ouro").size()).isEqualTo(1);
        assertThat(published).containsExactly("file:///test.ouro");
    }

    @Test
    @DisplayName("更新文档内容后延迟分析")
    void testChange() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        manager.open("file:///test.ouro", "var x = 1;");
        manager.setAnalysisCallback((uri, diagnostics) -> done.countDown());

        manager.change("file:///test.ouro", "var x: String = 2;");
        assertThat(manager.getContent("file:///test.ouro")).isEqualTo("var x: String = 2;");
        // 旧诊断立即失效
        assertThat(manager.getDiagnostics("file:///test.ouro")).isNull();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.getDiagnostics("file:///test.ouro").size()).isEqualTo(1);
    }

    @Test
    @DisplayName("连续修改只分析最后一次")
    void testDebounceCoalesces() throws InterruptedException {
        List<JsonArray> published = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        manager.setAnalysisCallback((uri, diagnostics) -> {
            published.add(diagnostics);
            done.countDown();
        });

        manager.change("file:///test.ouro", "var a = 1;");
        manager.change("file:///test.ouro", "var b = 2;");
        manager.change("file:///test.ouro", "var c: Bool = 3;");

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(DEBOUNCE_MS * 2);
        assertThat(published).hasSize(1);
        assertThat(published.get(0).size()).isEqualTo(1);
    }

    @Test
    @DisplayName("关闭文档后不可获取，待执行的分析被丢弃")
    void testClose() throws InterruptedException {
        List<String> published = new CopyOnWriteArrayList<>();
        manager.open("file:///test.ouro", "var x = 1;");
        manager.setAnalysisCallback((uri, diagnostics) -> published.add(uri));

        manager.change("file:///test.ouro", "var x = 2;");
        manager.close("file:///test.ouro");
        assertThat(manager.getContent("file:///test.ouro")).isNull();
        assertThat(manager.isOpen("file:///test.ouro")).isFalse();
        assertThat(manager.getDiagnostics("file:///test.ouro")).isNull();

        Thread.sleep(DEBOUNCE_MS * 3);
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("管理多个文档")
    void testMultipleDocuments() {
        manager.open("file:///a.ouro", "var a = 1;");
        manager.open("file:///b.ouro", "var b = 2;");

        assertThat(manager.getContent("file:///a.ouro")).isEqualTo("var a = 1;");
        assertThat(manager.getContent("file:///b.ouro")).isEqualTo("var b = 2;");
        assertThat(manager.getOpenDocuments()).containsExactlyInAnyOrder("file:///a.ouro", "file:///b.ouro");

        manager.close("file:///a.ouro");
        assertThat(manager.isOpen("file:///a.ouro")).isFalse();
        assertThat(manager.isOpen("file:///b.ouro")).isTrue();
    }

    @Test
    @DisplayName("负的 debounce 被拒绝")
    void testInvalidDebounce() {
        assertThatThrownBy(() -> new DocumentManager(new OuroAnalyzer(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
