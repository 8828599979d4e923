package io.lanmesh.network.frame;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.LineEncoder;
import io.netty.handler.codec.string.LineSeparator;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.util.CharsetUtil;

/**
 * Installs newline-delimited UTF-8 string framing; handlers added after it read
 * and write one line per {@link String}.
 */
public final class LinePipeline {

    public static final String FRAME_DECODER = "lineDecoder";
    public static final String STRING_DECODER = "stringDecoder";
    public static final String LINE_ENCODER = "lineEncoder";

    private LinePipeline() {}

    public static void install(ChannelPipeline pipeline, int maxFrameLength) {
        pipeline.addLast(FRAME_DECODER, new LineBasedFrameDecoder(maxFrameLength, true, true));
        pipeline.addLast(STRING_DECODER, new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(LINE_ENCODER, new LineEncoder(LineSeparator.UNIX, CharsetUtil.UTF_8));
    }
}
