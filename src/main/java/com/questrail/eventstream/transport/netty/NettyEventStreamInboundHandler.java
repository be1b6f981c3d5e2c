package com.questrail.eventstream.transport.netty;

import com.questrail.eventstream.transport.ByteChunkListener;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.util.Objects;

/**
 * NettyEventStreamInboundHandler
 * =============================================================================
 * Netty pipeline stage that forwards an event-stream body to a
 * {@link ByteChunkListener}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not decode
 * frames, buffer partial data, or interpret events; all of that happens behind
 * the listener.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code ByteBuf}, {@code ChannelHandlerContext}) MUST NOT
 * escape this package. Inbound content is copied into {@code byte[]}; the
 * reference-counted buffer is released by {@link SimpleChannelInboundHandler}.
 *
 * <h2>Lifecycle</h2>
 * One handler instance per channel (not {@code @Sharable}). Channel inactivity
 * ends the stream normally; an exception ends it with a cause and closes the
 * channel.
 */
public final class NettyEventStreamInboundHandler extends SimpleChannelInboundHandler<ByteBuf>
{
    private final ByteChunkListener listener;
    private boolean ended;

    public NettyEventStreamInboundHandler(ByteChunkListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
    {
        if (ended || !content.isReadable()) {
            return;
        }

        byte[] bytes = new byte[content.readableBytes()];
        content.getBytes(content.readerIndex(), bytes);
        listener.onChunk(bytes);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        end(null);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        end(cause);
        ctx.close();
    }

    private void end(Throwable cause)
    {
        if (!ended) {
            ended = true;
            listener.onStreamEnd(cause);
        }
    }
}
