package com.edge.annotator.core.codec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 逐行解码 UTF-8 文本文件
 * <p>
 * 与 {@link Files#readAllLines(Path)} 不同，单行中的非法字节不会让整个文件读取失败：
 * 该行以 null 占位，行号保持不变，由调用方记录错误后继续处理。
 * 行以 \n 分隔，行尾的 \r 会被去掉，文件末尾的换行不产生空行。
 */
final class LineDecoder {

    private LineDecoder() {
    }

    static List<String> readLines(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= bytes.length; i++) {
            boolean atEnd = i == bytes.length;
            if (!atEnd && bytes[i] != '\n') {
                continue;
            }
            if (atEnd && start == i) {
                break;
            }
            int end = i;
            if (end > start && bytes[end - 1] == '\r') {
                end--;
            }
            lines.add(decode(decoder, bytes, start, end - start));
            start = i + 1;
        }
        return lines;
    }

    /**
     * @return 解码后的行，字节序列不是合法 UTF-8 时返回 null
     */
    private static String decode(CharsetDecoder decoder, byte[] bytes, int offset, int length) {
        try {
            return decoder.reset().decode(ByteBuffer.wrap(bytes, offset, length)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
