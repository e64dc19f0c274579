package com.streamfirst.interchain.application.cursor;

/** Direction in which a cursor boundary is extended. */
enum ScanDirection {
  /** Catchup: towards genesis */
  BACKWARD,
  /** Realtime: towards the chain head */
  FORWARD
}
