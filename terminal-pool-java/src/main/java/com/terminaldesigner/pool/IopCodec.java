package com.terminaldesigner.pool;

/**
 * Binary ISO 11783-6 object pool codec (the {@code .iop} format).
 * The designer only depends on this boundary; the byte-level encoding is supplied by the host.
 */
public interface IopCodec {

    class IopFormatException extends Exception {
        public IopFormatException(String msg) { super(msg); }
        public IopFormatException(String msg, Throwable cause) { super(msg, cause); }
    }

    ObjectPool decode(byte[] data) throws IopFormatException;

    byte[] encode(ObjectPool pool);
}
