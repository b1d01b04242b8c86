/** Contract between the versioning engine and a storage backend. */
package com.tempora.versioning.spi;
