package com.jokes.common.status;

/**
 * Status codes for the outcomes a joke request can have. The names follow the gRPC
 * vocabulary where an equivalent exists.
 */
public enum StatusCode {
  OK,               // Request succeeded
  INVALID_ARGUMENT, // A value is outside its fixed vocabulary or range
  UNAVAILABLE,      // The transport failed or the body could not be read
  DATA_LOSS,        // The response body could not be decoded
  API_ERROR         // The service answered with an error payload
}
